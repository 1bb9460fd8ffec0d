package com.shoptrends.warehouse.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Natural key of {@link Item}: the (item name, category) pair.
 */
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class ItemKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private String itemName;

    private String category;

    @Override
    public String toString() {
        return "(" + itemName + ", " + category + ")";
    }
}
