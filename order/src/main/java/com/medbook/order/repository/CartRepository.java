package com.medbook.order.repository;

import com.medbook.order.domain.Cart;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CartRepository extends JpaRepository<Cart, Integer> {

    List<Cart> findByPatientIdOrderByIdAsc(Integer patientId);

    Optional<Cart> findByIdAndPatientId(Integer id, Integer patientId);

    boolean existsByIdAndPatientId(Integer id, Integer patientId);

    /**
     * No-op UPDATE so the set_updated_at trigger moves updated_at. Pending changes are flushed
     * first and the persistence context is cleared after: re-read the cart to see the new value.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE carts SET patient_id = patient_id WHERE id = :id", nativeQuery = true)
    int touch(@Param("id") Integer id);
}
