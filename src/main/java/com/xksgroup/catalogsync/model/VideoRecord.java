package com.xksgroup.catalogsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "videos")
public class VideoRecord {

    @Id
    private String id;

    @Indexed(unique = true)
    private String externalId;    // catalog identity, the only dedup and join key

    private String title;
    private String coverUrl;

    @Builder.Default
    private List<String> mediaList = new ArrayList<>();  // one playlist locator per episode, in order

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String downloadUrl;
    private String description;

    private int totalEpisodes;
    private int freeEpisodes;

    private Instant createdAt;
}
