package com.geotable.repository;

import com.geotable.model.ItemChangeEvent;

import java.util.List;

/**
 * Receives the change records of a table
 */
@FunctionalInterface
public interface ItemChangeListener {

    void onChanges(List<ItemChangeEvent> events);
}
