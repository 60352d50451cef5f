package com.medbook.order.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CartItemId implements Serializable {

    private static final long serialVersionUID = 1L;

    private Integer cartId;
    private Integer productId;
}
