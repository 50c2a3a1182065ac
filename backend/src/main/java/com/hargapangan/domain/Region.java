package com.hargapangan.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Administrative area known to the upstream price API.
 */
@Document(collection = "regions")
@CompoundIndex(name = "region_key", def = "{'provinceId': 1, 'cityId': 1, 'level': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Region {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Integer provinceId;
    private String provinceName;
    private Integer cityId;
    private String cityName;
    private Level level;
    private Instant createdAt;
    private Instant updatedAt;

    public enum Level {
        NATIONAL("national"),
        PROVINCE("province"),
        CITY("city");

        private final String code;

        Level(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }
}
