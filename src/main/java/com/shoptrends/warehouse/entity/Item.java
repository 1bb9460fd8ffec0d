package com.shoptrends.warehouse.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the Dim_Item table.
 * The same item name may appear under several categories; each pair is its own row.
 */
@Entity
@Table(name = "dim_item")
@IdClass(ItemKey.class)
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Item {

    @Id
    @Column(name = "item_name", nullable = false, length = 50)
    private String itemName;

    @Id
    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "size", length = 5)
    private String size;

    @Column(name = "color", length = 20)
    private String color;

    @Column(name = "season", length = 20)
    private String season;

    public ItemKey getKey() {
        return new ItemKey(itemName, category);
    }
}
