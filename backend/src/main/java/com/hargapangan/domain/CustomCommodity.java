package com.hargapangan.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * User-defined commodity referenced by market price reports; separate from the national registry.
 */
@Document(collection = "custom_commodities")
@CompoundIndex(name = "name_unit_category", def = "{'name': 1, 'unit': 1, 'category': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CustomCommodity {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private String unit;
    private String category;
    private String description;
    private String createdBy;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
