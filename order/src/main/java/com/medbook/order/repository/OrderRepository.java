package com.medbook.order.repository;

import com.medbook.order.domain.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * {@code findLocked...} finders issue SELECT ... FOR UPDATE;
 * a conditional transition loads through them so that two concurrent writers cannot both
 * observe the source state.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Integer> {

    List<Order> findByPatientIdOrderByUpdatedAtDesc(Integer patientId);

    Optional<Order> findByIdAndPatientId(Integer id, Integer patientId);

    Optional<Order> findByIdAndPatientIdAndStatus(Integer id, Integer patientId, Order.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findLockedById(Integer id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findLockedByIdAndPatientIdAndStatus(Integer id, Integer patientId, Order.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findLockedByIdAndPatientIdAndStatusAndDeletedAtIsNull(Integer id, Integer patientId,
                                                                          Order.Status status);
}
