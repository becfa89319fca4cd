package com.geotable.repository.impl;

import com.geotable.config.GeoTableProperties;
import com.geotable.exception.StoreException;
import com.geotable.model.GeoItem;
import com.geotable.model.IndexPage;
import com.geotable.model.IndexRow;
import com.geotable.model.ItemChangeEvent;
import com.geotable.model.RangeQuery;
import com.geotable.repository.GeoIndexStore;
import com.geotable.repository.ItemChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process table with a sorted geohash index.
 *
 * <p>Index entries are kept per partition (geohash prefix) in a skip list ordered by
 * geohash, then primary key. Items lacking either geohash attribute are stored but not
 * indexed. Continuation tokens encode the index entry to resume after.</p>
 */
@Repository
public class InMemoryGeoIndexStore implements GeoIndexStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGeoIndexStore.class);

    private static final char KEY_SEPARATOR = '\u0000';
    private static final char RANGE_END = '\u0001';

    private final GeoTableProperties properties;

    // Single source of truth for items, by primary key
    private final Map<String, GeoItem> items = new ConcurrentHashMap<>();

    // partition -> (geohash + separator + primary key) -> primary key
    private final Map<String, NavigableMap<String, String>> index = new ConcurrentHashMap<>();

    private final List<ItemChangeListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryGeoIndexStore(GeoTableProperties properties) {
        this.properties = properties;
    }

    @Override
    public void putItem(GeoItem item) {
        String primaryKey = primaryKeyOf(item.getAttributes());
        GeoItem previous;
        synchronized (this) {
            previous = items.put(primaryKey, item);
            if (previous != null) {
                unindex(primaryKey, previous);
            }
            indexItem(primaryKey, item);
        }
        publish(ItemChangeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(previous == null ? ItemChangeEvent.Type.INSERT : ItemChangeEvent.Type.MODIFY)
                .oldImage(previous)
                .newImage(item)
                .build());
    }

    @Override
    public Optional<GeoItem> getItem(Map<String, Object> key) {
        return Optional.ofNullable(items.get(primaryKeyOf(key)));
    }

    @Override
    public boolean deleteItem(Map<String, Object> key) {
        String primaryKey = primaryKeyOf(key);
        GeoItem removed;
        synchronized (this) {
            removed = items.remove(primaryKey);
            if (removed != null) {
                unindex(primaryKey, removed);
            }
        }
        if (removed == null) {
            return false;
        }
        publish(ItemChangeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(ItemChangeEvent.Type.REMOVE)
                .oldImage(removed)
                .build());
        return true;
    }

    @Override
    public IndexPage query(RangeQuery query) {
        if (query.getLimit() < 1) {
            throw new StoreException("Query limit must be positive: " + query.getLimit());
        }
        NavigableMap<String, String> partition = index.get(query.getPartitionKey());
        if (partition == null) {
            return IndexPage.empty();
        }

        NavigableMap<String, String> range;
        String upper = query.getSortKeyTo() + RANGE_END;
        if (query.getExclusiveStartKey() != null) {
            String start = decodeToken(query.getExclusiveStartKey());
            if (start.compareTo(upper) >= 0) {
                return IndexPage.empty();
            }
            range = partition.subMap(start, false, upper, false);
        } else {
            range = partition.subMap(query.getSortKeyFrom(), true, upper, false);
        }

        List<IndexRow> rows = new ArrayList<>();
        String lastKey = null;
        boolean more = false;
        for (Map.Entry<String, String> entry : range.entrySet()) {
            if (rows.size() >= query.getLimit()) {
                more = true;
                break;
            }
            GeoItem item = items.get(entry.getValue());
            if (item == null) {
                continue;
            }
            lastKey = encodeToken(entry.getKey());
            rows.add(new IndexRow(item, lastKey));
        }
        return new IndexPage(rows, more ? lastKey : null);
    }

    @Override
    public List<GeoItem> scan() {
        return new ArrayList<>(items.values());
    }

    @Override
    public void addChangeListener(ItemChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Remove every item without publishing change records
     */
    public synchronized void clear() {
        items.clear();
        index.clear();
        logger.info("Cleared all items");
    }

    private void indexItem(String primaryKey, GeoItem item) {
        Object prefix = item.get(properties.getGeohashPrefixField());
        Object geohash = item.get(properties.getGeohashField());
        if (prefix instanceof String && geohash instanceof String) {
            index.computeIfAbsent((String) prefix, p -> new ConcurrentSkipListMap<>())
                    .put(geohash + String.valueOf(KEY_SEPARATOR) + primaryKey, primaryKey);
        }
    }

    private void unindex(String primaryKey, GeoItem item) {
        Object prefix = item.get(properties.getGeohashPrefixField());
        Object geohash = item.get(properties.getGeohashField());
        if (prefix instanceof String && geohash instanceof String) {
            NavigableMap<String, String> partition = index.get(prefix);
            if (partition != null) {
                partition.remove(geohash + String.valueOf(KEY_SEPARATOR) + primaryKey);
            }
        }
    }

    private String primaryKeyOf(Map<String, Object> attributes) {
        Object partitionValue = attributes.get(properties.getPartitionKeyField());
        if (partitionValue == null) {
            throw new StoreException("Missing primary key attribute '" + properties.getPartitionKeyField() + "'");
        }
        String sortKeyField = properties.getSortKeyField();
        if (sortKeyField == null) {
            return partitionValue.toString();
        }
        Object sortValue = attributes.get(sortKeyField);
        if (sortValue == null) {
            throw new StoreException("Missing sort key attribute '" + sortKeyField + "'");
        }
        return partitionValue + String.valueOf(RANGE_END) + sortValue;
    }

    private void publish(ItemChangeEvent event) {
        List<ItemChangeEvent> events = Collections.singletonList(event);
        for (ItemChangeListener listener : listeners) {
            try {
                listener.onChanges(events);
            } catch (RuntimeException e) {
                // A failing consumer does not undo the write
                logger.error("Change listener failed on event {}", event.getEventId(), e);
            }
        }
    }

    private static String encodeToken(String indexKey) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(indexKey.getBytes(StandardCharsets.UTF_8));
    }

    private static String decodeToken(String token) {
        try {
            return new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Invalid exclusive start key", e);
        }
    }
}
