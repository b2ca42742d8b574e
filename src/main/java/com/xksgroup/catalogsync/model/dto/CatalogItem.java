package com.xksgroup.catalogsync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a catalog list page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogItem {

    @JsonProperty("id")
    private String externalId;

    private String title;

    private String cover;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @JsonProperty("total_episodes")
    private int totalEpisodes;
}
