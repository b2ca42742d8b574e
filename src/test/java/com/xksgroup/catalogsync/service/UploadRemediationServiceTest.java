package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.SyncAbortedException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Upload remediation recomputes {@code failedUploadIds} from scratch on every pass. It must never merge the
 * result into the previous set: a union here would keep ids that have since been fixed in the set forever.
 */
@DisplayName("Upload remediation")
class UploadRemediationServiceTest {

    @TempDir
    Path dir;

    private CatalogClient catalog;
    private InMemoryRecordStore recordStore;
    private ObjectStore oss;
    private ObjectStore s3;
    private MediaMirrorService mirror;
    private CheckpointStore checkpointStore;
    private UploadRemediationService service;

    @BeforeEach
    void setUp() {
        catalog = mock(CatalogClient.class);
        oss = mock(ObjectStore.class);
        when(oss.name()).thenReturn("oss");
        s3 = mock(ObjectStore.class);
        when(s3.name()).thenReturn("s3");
        mirror = mock(MediaMirrorService.class);
        when(mirror.mirror(any(), anyString(), anyString(), anyList(), any())).thenReturn(true);
        checkpointStore = new CheckpointStore(dir.resolve("state.json"));
        recordStore = new InMemoryRecordStore();
        service = new UploadRemediationService(catalog, recordStore, new ObjectStoreRegistry(List.of(oss, s3)), mirror, checkpointStore, 0);
    }

    private void seed(String token, String... failedIds) {
        SyncCheckpoint checkpoint = new SyncCheckpoint();
        checkpoint.advanceTo(4);
        checkpoint.setCredentialToken(token);
        checkpoint.addFailedUploads(List.of(failedIds));
        checkpointStore.save(checkpoint);
    }

    private void detail(String token, String id) {
        VideoDetail detail = VideoDetail.builder()
                .title("Title " + id)
                .videoList(List.of("https://origin.example.com/" + id + "/1.m3u8"))
                .cover("https://cdn.example.com/" + id + ".jpg")
                .build();
        when(catalog.fetchDetail(token, id)).thenReturn(CatalogResult.ok(detail));
    }

    @DisplayName("the written set is exactly what failed in this pass, whatever was there before")
    @Test
    void failureSetIsReplaced() {
        // given
        seed("tok", "A", "B", "C");
        detail("tok", "A");
        detail("tok", "B");
        detail("tok", "C");
        when(mirror.mirror(eq(oss), eq("B"), anyString(), anyList(), any())).thenReturn(false);

        // when
        Set<String> stillFailing = service.remediate("oss");

        // then
        assertEquals(Set.of("B"), stillFailing);
        SyncCheckpoint checkpoint = checkpointStore.load();
        assertEquals(Set.of("B"), checkpoint.getFailedUploadIds());
        assertEquals(4, checkpoint.getLastPage());
    }

    @DisplayName("an id that now succeeds leaves the set")
    @Test
    void successRemovesId() {
        seed("tok", "C");
        detail("tok", "C");

        assertTrue(service.remediate("oss").isEmpty());

        assertTrue(checkpointStore.load().getFailedUploadIds().isEmpty());
        verify(mirror).mirror(eq(oss), eq("C"), eq("Title C"),
                eq(List.of("https://origin.example.com/C/1.m3u8")), eq("https://cdn.example.com/C.jpg"));
    }

    @DisplayName("the command picks the object store by name")
    @Test
    void usesRequestedStore() {
        seed("tok", "C");
        detail("tok", "C");

        service.remediate("s3");

        verify(mirror).mirror(eq(s3), eq("C"), anyString(), anyList(), any());
        verify(mirror, never()).mirror(eq(oss), anyString(), anyString(), anyList(), any());
    }

    @DisplayName("an empty failure set is a clean no-op")
    @Test
    void emptySetIsNoOp() {
        seed("tok");

        assertTrue(service.remediate("oss").isEmpty());

        verifyNoInteractions(catalog, mirror);
    }

    @DisplayName("token expiry refreshes and retries; an id still rejected on its second attempt stays failing")
    @Test
    void tokenExpiryIsBoundedToTwoAttempts() {
        // given
        seed("old", "A", "B");
        when(catalog.fetchDetail("old", "A")).thenReturn(CatalogResult.retryable("token expired"));
        when(catalog.authenticate()).thenReturn(CatalogResult.ok("new"));
        detail("new", "A");
        when(catalog.fetchDetail("new", "B")).thenReturn(CatalogResult.retryable("token expired"));

        // when
        Set<String> stillFailing = service.remediate("oss");

        // then
        assertEquals(Set.of("B"), stillFailing);
        verify(catalog, times(2)).authenticate();
        verify(catalog, times(2)).fetchDetail("new", "B");
        assertEquals("new", checkpointStore.load().getCredentialToken());
    }

    @DisplayName("a fatal detail keeps the id failing; an empty detail drops it")
    @Test
    void fatalKeepsEmptyDrops() {
        seed("tok", "F", "E");
        when(catalog.fetchDetail("tok", "F")).thenReturn(CatalogResult.fatal("HTTP 502"));
        when(catalog.fetchDetail("tok", "E")).thenReturn(CatalogResult.ok(null));

        assertEquals(Set.of("F"), service.remediate("oss"));
        verify(mirror, never()).mirror(any(), anyString(), anyString(), anyList(), any());
    }

    @DisplayName("a failed refresh aborts the pass and leaves the stored set untouched")
    @Test
    void refreshFailureAborts() {
        seed("old", "A", "B");
        when(catalog.fetchDetail("old", "A")).thenReturn(CatalogResult.retryable("token expired"));
        when(catalog.authenticate()).thenReturn(CatalogResult.fatal("login rejected"));

        assertThrows(SyncAbortedException.class, () -> service.remediate("oss"));
        assertEquals(Set.of("A", "B"), checkpointStore.load().getFailedUploadIds());
    }

    @DisplayName("keys come from the stored title, so a detail without a title mirrors to the same addresses as ingestion")
    @Test
    void storedTitleDrivesKeys() {
        // given
        seed("tok", "B");
        recordStore.preload("B", "Bravo");
        VideoDetail untitled = VideoDetail.builder()
                .title(" ")
                .videoList(List.of("https://origin.example.com/B/1.m3u8"))
                .cover("https://cdn.example.com/B.jpg")
                .build();
        when(catalog.fetchDetail("tok", "B")).thenReturn(CatalogResult.ok(untitled));

        // when
        Set<String> stillFailing = service.remediate("oss");

        // then
        assertTrue(stillFailing.isEmpty());
        verify(mirror).mirror(eq(oss), eq("B"), eq("Bravo"),
                eq(List.of("https://origin.example.com/B/1.m3u8")), eq("https://cdn.example.com/B.jpg"));
    }

    @DisplayName("with no stored record and no detail title there is nothing to derive keys from, so the id stays failing")
    @Test
    void noTitleKeepsId() {
        seed("tok", "B");
        when(catalog.fetchDetail("tok", "B")).thenReturn(CatalogResult.ok(VideoDetail.builder().build()));

        assertEquals(Set.of("B"), service.remediate("oss"));
        verify(mirror, never()).mirror(any(), anyString(), any(), anyList(), any());
    }

    @DisplayName("a failing record store keeps the id failing")
    @Test
    void recordStoreFailureKeepsId() {
        seed("tok", "C");
        detail("tok", "C");
        recordStore.fetchManyFails = true;

        assertEquals(Set.of("C"), service.remediate("oss"));
        verify(mirror, never()).mirror(any(), anyString(), any(), anyList(), any());
    }
}
