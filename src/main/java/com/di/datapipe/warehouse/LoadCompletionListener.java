package com.di.datapipe.warehouse;

import com.di.datapipe.state.TableLoadMarker;

/** Notified after a table's completion marker has advanced. */
@FunctionalInterface
public interface LoadCompletionListener {

    void onLoadCompleted(TableLoadMarker marker);
}
