/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.io;

import com.powsybl.graphtheory.graph.AttributeTags;
import com.powsybl.graphtheory.graph.AttributeValue;
import com.powsybl.graphtheory.graph.Graph;
import com.powsybl.graphtheory.graph.JGraphTModel;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a graph in the dot language with the JGraphT dot exporter, in the shape {@link DotReader} reads back: every
 * vertex with its attributes, in index order, then every edge with its attributes. A weighted graph gets a
 * {@code weighted=true} graph attribute and a {@code weight} attribute on every edge. Vertex labels are always quoted,
 * and a graph without name is written with the identifier {@code G}.
 *
 * @author PowSyBl graph theory team
 */
public final class DotWriter {

    private static final AttributeTags TAGS = new AttributeTags();

    private DotWriter() {
    }

    public static void write(Graph graph, Path file) {
        Objects.requireNonNull(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(graph, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toString(Graph graph) {
        StringWriter writer = new StringWriter();
        write(graph, writer);
        return writer.toString();
    }

    public static void write(Graph graph, Writer writer) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(writer);
        org.jgrapht.Graph<Integer, DefaultWeightedEdge> jgraph = JGraphTModel.toJGraphT(graph);
        DOTExporter<Integer, DefaultWeightedEdge> exporter = new DOTExporter<>(v -> quote(graph.getVertexLabel(v)));
        if (graph.getName() != null) {
            exporter.setGraphIdProvider(() -> quote(graph.getName()));
        }
        exporter.setGraphAttributeProvider(() -> graphAttributes(graph));
        exporter.setVertexAttributeProvider(v -> attributes(graph.getVertexAttributes(v)));
        exporter.setEdgeAttributeProvider(e -> attributes(graph.getEdgeAttributes(jgraph.getEdgeSource(e), jgraph.getEdgeTarget(e))));
        exporter.exportGraph(jgraph, writer);
    }

    /**
     * Graph attributes are written unquoted by the exporter, so keys and values are quoted here.
     */
    private static Map<String, Attribute> graphAttributes(Graph graph) {
        Map<String, Attribute> attributes = new LinkedHashMap<>();
        if (graph.isWeighted()) {
            attributes.put(TAGS.getTag(AttributeTags.WEIGHTED), DefaultAttribute.createAttribute(Boolean.TRUE));
        }
        graph.getGraphAttributes().forEach((key, value) -> {
            int tag = TAGS.getKey(key);
            if (tag != AttributeTags.DIRECTED && tag != AttributeTags.WEIGHTED) {
                attributes.put(quote(key), DefaultAttribute.createAttribute(quote(value.toString())));
            }
        });
        return attributes;
    }

    private static Map<String, Attribute> attributes(Map<String, AttributeValue> values) {
        Map<String, Attribute> attributes = new LinkedHashMap<>();
        values.forEach((key, value) -> attributes.put(key, DefaultAttribute.createAttribute(value.toString())));
        return attributes;
    }

    static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
