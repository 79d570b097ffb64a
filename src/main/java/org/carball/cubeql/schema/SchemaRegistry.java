package org.carball.cubeql.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Holds the current schema snapshot. A reload builds a complete new snapshot and swaps it in one
 * step, so compilations that already hold the previous snapshot keep a consistent view.
 */
@Slf4j
public class SchemaRegistry {

    private final AtomicReference<SchemaSnapshot> current;
    private final List<Consumer<SchemaSnapshot>> reloadListeners = new CopyOnWriteArrayList<>();

    public SchemaRegistry(Collection<Cube> cubes) {
        this.current = new AtomicReference<>(SchemaSnapshot.of(1, cubes));
        log.info("Loaded schema version 1 with {} cubes", cubes.size());
    }

    public SchemaSnapshot snapshot() {
        return current.get();
    }

    /**
     * Replaces the whole schema. Invalid definitions leave the current snapshot in place.
     *
     * @return the snapshot now in effect
     */
    public SchemaSnapshot reload(Collection<Cube> cubes) {
        SchemaSnapshot next = current.updateAndGet(previous -> SchemaSnapshot.of(previous.getVersion() + 1, cubes));
        log.info("Reloaded schema: version {} with {} cubes", next.getVersion(), next.getCubes().size());
        reloadListeners.forEach(listener -> listener.accept(next));
        return next;
    }

    public void addReloadListener(Consumer<SchemaSnapshot> listener) {
        reloadListeners.add(listener);
    }
}
