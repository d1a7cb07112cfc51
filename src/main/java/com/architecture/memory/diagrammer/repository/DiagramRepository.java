package com.architecture.memory.diagrammer.repository;

import com.architecture.memory.diagrammer.model.diagram.Diagram;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory diagram store. Diagrams live for the lifetime of the process.
 */
@Repository
public class DiagramRepository {

    private final Map<String, Diagram> diagrams = new ConcurrentHashMap<>();

    public Diagram save(Diagram diagram) {
        diagrams.put(diagram.getId(), diagram);
        return diagram;
    }

    public Optional<Diagram> findById(String id) {
        return Optional.ofNullable(diagrams.get(id));
    }

    public List<Diagram> findAll() {
        return new ArrayList<>(diagrams.values());
    }

    public boolean existsById(String id) {
        return diagrams.containsKey(id);
    }

    public void deleteById(String id) {
        diagrams.remove(id);
    }
}
