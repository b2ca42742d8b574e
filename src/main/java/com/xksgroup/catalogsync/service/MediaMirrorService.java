package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.service.helper.ContentAddressHelper;
import com.xksgroup.catalogsync.service.helper.MediaDownloader;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Mirrors one catalog entry (every episode playlist, then the cover) into an {@link ObjectStore}.
 * <p>
 * Success is tracked per item only: if any episode or the cover fails, the whole item is reported failed
 * and a later remediation pass re-drives all of it. Objects already present under their content address
 * are not uploaded again.
 */
@Slf4j
@Service
public class MediaMirrorService {

    static final String PLAYLIST_FILE = "origin.m3u8";
    static final String DEFAULT_COVER_TYPE = "image/jpeg";

    private final ContentAddressHelper addressHelper;
    private final MediaDownloader downloader;

    @Autowired
    public MediaMirrorService(ContentAddressHelper addressHelper,
                              @Qualifier("originHttpClient") OkHttpClient originHttpClient) {
        this(addressHelper, new MediaDownloader(originHttpClient));
    }

    MediaMirrorService(ContentAddressHelper addressHelper, MediaDownloader downloader) {
        this.addressHelper = addressHelper;
        this.downloader = downloader;
    }

    /**
     * @return true when every episode and the cover are present in the store afterwards
     */
    public boolean mirror(ObjectStore store, String externalId, String title, List<String> mediaList, String coverUrl) {
        log.info("[{}] Mirroring '{}' (id: {}, episodes: {})", store.name(), title, externalId, mediaList.size());

        try {
            for (int i = 0; i < mediaList.size(); i++) {
                int episode = i + 1;
                String mediaUrl = mediaList.get(i);
                if (mediaUrl == null || mediaUrl.isBlank()) {
                    log.warn("Skipping empty media locator (id: {}, episode {})", externalId, episode);
                    continue;
                }

                String key = addressHelper.mediaKey(title, externalId, episode) + "/" + PLAYLIST_FILE;
                if (store.exists(key)) {
                    log.debug("Episode {} of {} already mirrored: {}", episode, externalId, key);
                    continue;
                }
                store.putStream(key, mediaUrl);
            }

            if (coverUrl == null || coverUrl.isBlank()) {
                log.error("[{}] No cover for '{}' (id: {}), item stays incomplete", store.name(), title, externalId);
                return false;
            }
            String coverKey = addressHelper.coverKey(title, externalId);
            if (store.exists(coverKey)) {
                log.debug("Cover of {} already mirrored: {}", externalId, coverKey);
            } else {
                MediaDownloader.Download cover = downloader.download(coverUrl);
                String contentType = cover.contentType() != null ? cover.contentType() : DEFAULT_COVER_TYPE;
                store.putBlob(coverKey, cover.bytes(), contentType);
            }

            log.info("[{}] Mirror complete for '{}' (id: {})", store.name(), title, externalId);
            return true;

        } catch (Exception e) {
            log.error("[{}] Mirror failed for '{}' (id: {}): {}", store.name(), title, externalId, e.getMessage());
            return false;
        }
    }
}
