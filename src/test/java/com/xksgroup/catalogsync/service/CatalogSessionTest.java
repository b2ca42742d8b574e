package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.AuthException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Catalog session")
class CatalogSessionTest {

    @TempDir
    Path dir;

    @DisplayName("refresh stores the new token in the session and on disk")
    @Test
    void refresh_persistsToken() {
        // given
        CatalogClient client = mock(CatalogClient.class);
        when(client.authenticate()).thenReturn(CatalogResult.ok("fresh"));
        when(client.defaultPageSize()).thenReturn(20);
        CheckpointStore store = new CheckpointStore(dir.resolve("state.json"));
        SyncCheckpoint checkpoint = store.load();
        CatalogSession session = new CatalogSession(client, store, checkpoint);

        // when
        session.refresh();
        session.listPage(1);

        // then
        assertEquals("fresh", session.getToken());
        assertEquals("fresh", store.load().getCredentialToken());
        verify(client).listPage("fresh", 1, 20);
    }

    @DisplayName("a failed refresh is an AuthException and keeps the old token")
    @Test
    void refresh_failure() {
        CatalogClient client = mock(CatalogClient.class);
        when(client.authenticate()).thenReturn(CatalogResult.fatal("rejected"));
        CheckpointStore store = new CheckpointStore(dir.resolve("state.json"));
        SyncCheckpoint checkpoint = store.load();
        checkpoint.setCredentialToken("cached");
        CatalogSession session = new CatalogSession(client, store, checkpoint);

        assertThrows(AuthException.class, session::refresh);
        assertEquals("cached", session.getToken());
    }
}
