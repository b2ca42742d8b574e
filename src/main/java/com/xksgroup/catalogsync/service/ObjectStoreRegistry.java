package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.CatalogSyncException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up an {@link ObjectStore} bean by its short name ({@code oss}, {@code s3}).
 */
@Component
public class ObjectStoreRegistry {

    private final Map<String, ObjectStore> stores = new LinkedHashMap<>();

    public ObjectStoreRegistry(List<ObjectStore> stores) {
        stores.forEach(s -> this.stores.put(s.name(), s));
    }

    public ObjectStore get(String name) {
        ObjectStore store = stores.get(name);
        if (store == null) {
            throw new CatalogSyncException("Unknown object store '" + name + "', expected one of " + stores.keySet());
        }
        return store;
    }
}
