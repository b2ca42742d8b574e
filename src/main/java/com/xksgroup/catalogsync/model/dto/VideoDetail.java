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
 * Detail payload of a single catalog entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoDetail {

    private String title;

    @Builder.Default
    @JsonProperty("video_list")
    private List<String> videoList = new ArrayList<>();

    @JsonProperty("download_url")
    private String downloadUrl;

    private String cover;

    private String desc;

    @JsonProperty("c_desc")
    private String fallbackDesc;

    @JsonProperty("free_watch_episodes")
    private int freeWatchEpisodes;

    public String resolvedDescription() {
        if (desc != null && !desc.isBlank()) {
            return desc;
        }
        return fallbackDesc != null ? fallbackDesc : "";
    }

    public List<String> safeVideoList() {
        return videoList != null ? videoList : List.of();
    }
}
