package com.medbook.order.repository;

import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.CartItemId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface CartItemRepository extends JpaRepository<CartItem, CartItemId> {

    List<CartItem> findByCartIdOrderByProductIdAsc(Integer cartId);

    List<CartItem> findByCartIdIn(Collection<Integer> cartIds);

    /** Same as {@link CartRepository#touch}, for every item left in the cart. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE cart_items SET quantity = quantity WHERE cart_id = :cartId", nativeQuery = true)
    int touchByCartId(@Param("cartId") Integer cartId);
}
