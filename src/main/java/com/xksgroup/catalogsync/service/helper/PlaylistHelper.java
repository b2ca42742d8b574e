package com.xksgroup.catalogsync.service.helper;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

/**
 * Playlist text rewriting for mirrored HLS media playlists.
 */
@Slf4j
public final class PlaylistHelper {

    private PlaylistHelper() {
    }

    /**
     * Rewrites relative segment references ({@code *.ts} or {@code .../ts?...}) into absolute URLs resolved
     * against the playlist's own location, so the mirrored copy keeps streaming segments from the origin.
     * Tags, comments, blank lines and already-absolute references are left untouched.
     */
    public static String absolutizeSegments(String content, String playlistUrl) {
        HttpUrl base = HttpUrl.parse(playlistUrl);
        if (base == null) {
            throw new IllegalArgumentException("Playlist URL is not an http(s) URL: " + playlistUrl);
        }

        String[] lines = content.split("\n", -1);
        StringBuilder sb = new StringBuilder(content.length() + 256);
        int rewritten = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.trim();

            if (isSegmentReference(trimmed)) {
                if (trimmed.startsWith("http")) {
                    line = trimmed;
                } else {
                    HttpUrl absolute = base.resolve(trimmed);
                    if (absolute != null) {
                        line = absolute.toString();
                        rewritten++;
                    } else {
                        log.warn("Could not resolve segment reference '{}' against {}", trimmed, playlistUrl);
                    }
                }
            }

            sb.append(line);
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }

        log.debug("Rewrote {} relative segment references in {}", rewritten, playlistUrl);
        return sb.toString();
    }

    private static boolean isSegmentReference(String trimmed) {
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return false;
        }
        return trimmed.endsWith(".ts") || trimmed.contains("/ts?");
    }
}
