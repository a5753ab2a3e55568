/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.io;

import com.google.common.io.CharStreams;
import com.powsybl.graphtheory.graph.AttributeTags;
import com.powsybl.graphtheory.graph.AttributeValue;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.GraphError;
import com.powsybl.graphtheory.graph.GraphException;
import org.jgrapht.alg.util.Pair;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.dot.DOTEventDrivenImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a graph from the dot language, parsed by the JGraphT dot importer.
 * <p>
 * Vertex statements, chained edge statements, subgraphs, {@code graph}, {@code node} and {@code edge} default
 * attribute statements and {@code key=value} graph attributes are accepted. The graph is directed when its header is
 * {@code digraph}. It is weighted if it has a {@code weighted=true} attribute or if an edge has a {@code weight}
 * attribute, unweighted edges then getting weight 1.
 * <p>
 * Vertices are numbered in order of first appearance. A malformed input raises a
 * {@link GraphError#DOT_READ_FAILURE} error and no graph is returned.
 *
 * @author PowSyBl graph theory team
 */
public final class DotReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DotReader.class);

    private static final Pattern POINT = Pattern.compile("\\s*-?[0-9.]+(?:[eE][-+]?[0-9]+)?(?:\\s*,\\s*-?[0-9.]+(?:[eE][-+]?[0-9]+)?){1,2}\\s*");

    /**
     * Leading comments and the header keywords.
     */
    private static final Pattern HEADER = Pattern.compile("\\A(?:\\s+|//[^\\n]*|#[^\\n]*|/\\*.*?\\*/)*(?:strict\\s+)?(di)?graph\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final String ID = "ID";

    private static final AttributeTags TAGS = new AttributeTags();

    private final Map<String, String> graphAttributes = new LinkedHashMap<>();

    private final Map<String, Map<String, String>> vertices = new LinkedHashMap<>();

    private final List<Pair<String, String>> edges = new ArrayList<>();

    private final Map<Pair<String, String>, Map<String, String>> edgeAttributes = new HashMap<>();

    private DotReader() {
    }

    public static Graph read(Path file) {
        Objects.requireNonNull(file);
        try {
            return read(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Graph read(Reader reader) {
        Objects.requireNonNull(reader);
        try {
            return read(CharStreams.toString(reader));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Graph read(String text) {
        Objects.requireNonNull(text);
        Matcher header = HEADER.matcher(text);
        if (!header.lookingAt()) {
            throw new GraphException(GraphError.DOT_READ_FAILURE, "'graph' or 'digraph' expected");
        }
        DotReader reader = new DotReader();
        reader.importText(text);
        Graph graph = reader.build(header.group(1) != null);
        LOGGER.debug("Graph with {} vertices and {} edges read", graph.getVertexCount(), graph.getEdgeCount());
        return graph;
    }

    private Map<String, String> vertex(String id) {
        return vertices.computeIfAbsent(id, k -> new LinkedHashMap<>());
    }

    private void importText(String text) {
        DOTEventDrivenImporter importer = new DOTEventDrivenImporter(true, true);
        importer.addGraphAttributeConsumer((key, attribute) -> graphAttributes.put(key, attribute.getValue()));
        importer.addVertexConsumer(this::vertex);
        importer.addVertexAttributeConsumer((Pair<String, String> p, Attribute attribute) -> {
            // the importer reports the vertex identifier as an attribute too
            if (!(ID.equals(p.getSecond()) && p.getFirst().equals(attribute.getValue()))) {
                vertex(p.getFirst()).put(p.getSecond(), attribute.getValue());
            }
        });
        importer.addEdgeConsumer(e -> {
            vertex(e.getFirst());
            vertex(e.getSecond());
            edges.add(e);
        });
        importer.addEdgeAttributeConsumer((Pair<Pair<String, String>, String> p, Attribute attribute) ->
                edgeAttributes.computeIfAbsent(p.getFirst(), k -> new LinkedHashMap<>()).put(p.getSecond(), attribute.getValue()));
        try {
            importer.importInput(new StringReader(text));
        } catch (ImportException e) {
            throw new GraphException(GraphError.DOT_READ_FAILURE, e.getMessage(), e);
        }
    }

    private static AttributeValue toValue(String key, String text) {
        if (TAGS.getKey(key) == AttributeTags.POSITION && POINT.matcher(text).matches()) {
            return AttributeValue.ofPoint(Arrays.stream(text.split(",")).map(String::trim).mapToDouble(Double::parseDouble).toArray());
        }
        return AttributeValue.parse(text);
    }

    private Graph build(boolean directed) {
        String weightTag = TAGS.getTag(AttributeTags.WEIGHT);
        boolean weighted = "true".equals(graphAttributes.get(TAGS.getTag(AttributeTags.WEIGHTED)))
                || edgeAttributes.values().stream().anyMatch(attributes -> attributes.containsKey(weightTag));
        Graph graph = new Graph(directed, weighted);
        graphAttributes.forEach((key, value) -> {
            if (ID.equals(key)) {
                graph.setName(value);
            } else if (TAGS.getKey(key) != AttributeTags.DIRECTED && TAGS.getKey(key) != AttributeTags.WEIGHTED) {
                graph.setGraphAttribute(key, toValue(key, value));
            }
        });
        vertices.forEach((label, attributes) -> {
            int v = graph.addVertex(label);
            attributes.forEach((key, value) -> graph.setVertexAttribute(v, key, toValue(key, value)));
        });
        for (Pair<String, String> e : edges) {
            if (e.getFirst().equals(e.getSecond())) {
                throw new GraphException(GraphError.DOT_READ_FAILURE, "self loop on vertex '" + e.getFirst() + "'");
            }
            int i = graph.getVertexIndex(e.getFirst());
            int j = graph.getVertexIndex(e.getSecond());
            Map<String, String> attributes = edgeAttributes.getOrDefault(e, Collections.emptyMap());
            if (weighted) {
                String w = attributes.get(weightTag);
                AttributeValue weight = w != null ? AttributeValue.parse(w) : AttributeValue.of(1.0);
                if (!weight.isNumber()) {
                    throw new GraphException(GraphError.DOT_READ_FAILURE, "invalid edge weight '" + w + "'");
                }
                graph.addEdge(i, j, weight.asNumber());
            } else {
                graph.addEdge(i, j);
            }
            attributes.forEach((key, value) -> {
                if (!weightTag.equals(key)) {
                    graph.setEdgeAttribute(i, j, key, toValue(key, value));
                }
            });
        }
        return graph;
    }
}
