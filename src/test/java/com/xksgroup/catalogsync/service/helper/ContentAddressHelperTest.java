package com.xksgroup.catalogsync.service.helper;

import com.xksgroup.catalogsync.exception.InvalidResourceKindException;
import com.xksgroup.catalogsync.exception.MissingEpisodeIndexException;
import com.xksgroup.catalogsync.model.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Content-address key derivation")
class ContentAddressHelperTest {

    private final ContentAddressHelper helper = new ContentAddressHelper("test-secret", "video_data");

    @DisplayName("same input always yields the same key, across instances")
    @Test
    void derive_isDeterministic() {
        ContentAddressHelper other = new ContentAddressHelper("test-secret", "video_data");

        for (int episode = 1; episode <= 3; episode++) {
            assertEquals(helper.mediaKey("Title", "B", episode), helper.mediaKey("Title", "B", episode));
            assertEquals(helper.mediaKey("Title", "B", episode), other.mediaKey("Title", "B", episode));
        }
        assertEquals(helper.coverKey("Title", "B"), other.coverKey("Title", "B"));
        assertEquals(helper.coverKey("Title", "B"),
                helper.derive("Title", "B", ResourceKind.COVER, null));
    }

    @DisplayName("cover key has the shape prefix/id/E(title|id)/cover.jpg")
    @Test
    void coverKey_shape() {
        // when
        String key = helper.coverKey("Bravo", "B");

        // then
        assertTrue(key.matches("video_data/B/[A-Za-z0-9_-]+/cover\\.jpg"), key);
        assertEquals("Bravo|B", helper.reveal(key.split("/")[2]));
    }

    @DisplayName("media key has the shape prefix/id/E(title|id)/n/E(title|id|n)")
    @Test
    void mediaKey_shape() {
        // when
        String[] parts = helper.mediaKey("Bravo", "B", 2).split("/");

        // then
        assertEquals(5, parts.length);
        assertEquals("video_data", parts[0]);
        assertEquals("B", parts[1]);
        assertEquals("2", parts[3]);
        assertEquals("Bravo|B", helper.reveal(parts[2]));
        assertEquals("Bravo|B|2", helper.reveal(parts[4]));
        assertEquals(helper.coverKey("Bravo", "B").split("/")[2], parts[2]);
    }

    @DisplayName("segments are URL-safe Base64 without padding")
    @Test
    void segments_areUrlSafe() {
        String key = helper.mediaKey("A title with / slashes + pluses ?", "123456", 10);

        assertFalse(key.contains("="));
        assertFalse(key.contains("+"));
        assertEquals(5, key.split("/").length);
    }

    @DisplayName("a different secret yields different keys")
    @Test
    void differentSecret_differentKeys() {
        ContentAddressHelper other = new ContentAddressHelper("another-secret", "video_data");

        assertNotEquals(helper.coverKey("Bravo", "B"), other.coverKey("Bravo", "B"));
    }

    @DisplayName("trailing slashes on the prefix are ignored")
    @Test
    void prefix_trailingSlash() {
        ContentAddressHelper slashed = new ContentAddressHelper("test-secret", "video_data/");

        assertEquals(helper.coverKey("Bravo", "B"), slashed.coverKey("Bravo", "B"));
    }

    @DisplayName("missing kind is rejected")
    @Test
    void derive_nullKind() {
        assertThrows(InvalidResourceKindException.class, () -> helper.derive("Bravo", "B", null, 1));
    }

    @DisplayName("media keys need an episode index starting at 1")
    @Test
    void derive_missingEpisode() {
        assertThrows(MissingEpisodeIndexException.class,
                () -> helper.derive("Bravo", "B", ResourceKind.MEDIA_SEGMENT, null));
        assertThrows(MissingEpisodeIndexException.class,
                () -> helper.derive("Bravo", "B", ResourceKind.MEDIA_SEGMENT, 0));
    }

    @DisplayName("kind names parse case-insensitively; unknown names are rejected")
    @Test
    void parseKind() {
        assertEquals(ResourceKind.MEDIA_SEGMENT, ContentAddressHelper.parseKind("m3u8"));
        assertEquals(ResourceKind.MEDIA_SEGMENT, ContentAddressHelper.parseKind("MEDIA_SEGMENT"));
        assertEquals(ResourceKind.COVER, ContentAddressHelper.parseKind(" Cover "));
        assertThrows(InvalidResourceKindException.class, () -> ContentAddressHelper.parseKind("poster"));
        assertThrows(InvalidResourceKindException.class, () -> ContentAddressHelper.parseKind(null));
    }

    @DisplayName("reveal rejects text that is not one of our segments")
    @Test
    void reveal_rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> helper.reveal("not*base64"));
    }
}
