package com.booking.realtime.catalog;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.security.TableSecurityDescriptor;
import com.booking.realtime.visibility.TableSecurityCatalog;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Keeps descriptors for a bounded time so grants and policy switches are picked up without a
 * catalog query per change. Unknown entities are not cached.
 */
public class CachingTableSecurityCatalog implements TableSecurityCatalog {

    public interface Configuration {
        String TTL = "catalog.cache.ttl.ms";
        String MAXIMUM_SIZE = "catalog.cache.size";
    }

    private final TableSecurityCatalog delegate;
    private final Cache<String, TableSecurityDescriptor> cache;

    public CachingTableSecurityCatalog(TableSecurityCatalog delegate, long ttlMillis, long maximumSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttlMillis, TimeUnit.MILLISECONDS)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public TableSecurityDescriptor describe(EntityName entity, String role) throws IOException {
        String key = String.format("%s@%s", role, entity);
        TableSecurityDescriptor descriptor = this.cache.getIfPresent(key);

        if (descriptor == null) {
            descriptor = this.delegate.describe(entity, role);

            if (descriptor != null) {
                this.cache.put(key, descriptor);
            }
        }

        return descriptor;
    }

    public void invalidateAll() {
        this.cache.invalidateAll();
    }

    @Override
    public void close() throws IOException {
        this.cache.invalidateAll();
        this.delegate.close();
    }

    public static TableSecurityCatalog build(Map<String, Object> configuration, TableSecurityCatalog delegate) {
        long ttl = Long.parseLong(configuration.getOrDefault(Configuration.TTL, "10000").toString());
        long size = Long.parseLong(configuration.getOrDefault(Configuration.MAXIMUM_SIZE, "10000").toString());

        if (ttl <= 0) {
            return delegate;
        }

        return new CachingTableSecurityCatalog(delegate, ttl, size);
    }
}
