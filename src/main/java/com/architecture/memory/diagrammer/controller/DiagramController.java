package com.architecture.memory.diagrammer.controller;

import com.architecture.memory.diagrammer.dto.diagram.*;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.service.DiagramService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/diagrams")
@RequiredArgsConstructor
public class DiagramController {

    private final DiagramService diagramService;

    @PostMapping
    public ResponseEntity<Diagram> createDiagram(@Valid @RequestBody CreateDiagramRequest request) {
        return new ResponseEntity<>(diagramService.createDiagram(request), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<List<DiagramSummary>> getAllDiagrams() {
        return ResponseEntity.ok(diagramService.listDiagrams());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Diagram> getDiagram(@PathVariable String id) {
        return ResponseEntity.ok(diagramService.getDiagram(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDiagram(@PathVariable String id) {
        diagramService.deleteDiagram(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/vertices")
    public ResponseEntity<CellCreatedResponse> addVertex(
            @PathVariable String id,
            @Valid @RequestBody AddVertexRequest request) {
        String cellId = diagramService.addVertex(id, request);
        return new ResponseEntity<>(new CellCreatedResponse(id, cellId), HttpStatus.CREATED);
    }

    @PostMapping("/{id}/edges")
    public ResponseEntity<CellCreatedResponse> addEdge(
            @PathVariable String id,
            @Valid @RequestBody AddEdgeRequest request) {
        String cellId = diagramService.addEdge(id, request);
        return new ResponseEntity<>(new CellCreatedResponse(id, cellId), HttpStatus.CREATED);
    }
}
