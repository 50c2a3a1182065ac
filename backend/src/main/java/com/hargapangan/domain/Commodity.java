package com.hargapangan.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * National commodity. Created on first sighting in an upstream snapshot or by an admin;
 * soft-deleted through {@code active=false}, never removed.
 */
@Document(collection = "commodities")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Commodity {

    public static final String DEFAULT_UNIT = "Rp/kg";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Upstream commodity id; unique when present. */
    @Indexed(unique = true, sparse = true)
    private Integer externalId;
    private String name;
    private String unit;
    private CommodityCategory category;
    private String iconUrl;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
