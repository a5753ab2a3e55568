/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import com.powsybl.math.matrix.DenseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Index based graph model.
 * <p>
 * Vertices are stored in an ordered list and address each other by index (0..n-1). An edge is not a stored object:
 * it is an entry of the source vertex neighbor map, holding the edge attributes. In an undirected graph, the entries
 * (i, j) and (j, i) always exist together and share the same attribute map.
 * <p>
 * Vertex indices are stable until a vertex is removed: removal compacts the vertex list, so every index greater than
 * the removed one is decremented. Callers must not keep indices across a removal.
 * <p>
 * This class is not thread safe.
 *
 * @author PowSyBl graph theory team
 */
public class Graph {

    private static final Logger LOGGER = LoggerFactory.getLogger(Graph.class);

    public static final int NOT_FOUND = -1;

    private final List<Vertex> vertices = new ArrayList<>();

    private final Map<String, Integer> indicesByLabel = new HashMap<>();

    private final Map<Integer, AttributeValue> attributes = new TreeMap<>();

    private final AttributeTags tags;

    private final List<Integer> markedVertices = new ArrayList<>();

    private String name;

    public Graph() {
        this(false, false);
    }

    public Graph(boolean directed) {
        this(directed, false);
    }

    public Graph(boolean directed, boolean weighted) {
        this(directed, weighted, new AttributeTags());
    }

    /**
     * Create an empty graph sharing a copy of the given tag registry.
     */
    public Graph(boolean directed, boolean weighted, AttributeTags tags) {
        this.tags = new AttributeTags(tags);
        attributes.put(AttributeTags.DIRECTED, AttributeValue.of(directed));
        attributes.put(AttributeTags.WEIGHTED, AttributeValue.of(weighted));
    }

    /**
     * Deep copy constructor.
     */
    public Graph(Graph other) {
        this(other.isDirected(), other.isWeighted(), other.tags);
        name = other.name;
        attributes.putAll(other.attributes);
        for (Vertex v : other.vertices) {
            Vertex copy = new Vertex(v.getLabel());
            copy.getAttributes().putAll(v.getAttributes());
            indicesByLabel.put(v.getLabel(), vertices.size());
            vertices.add(copy);
        }
        for (int i = 0; i < other.vertices.size(); i++) {
            for (Map.Entry<Integer, Map<Integer, AttributeValue>> e : other.vertices.get(i).getNeighbors().entrySet()) {
                int j = e.getKey();
                if (isDirected() || i < j) {
                    addEdgeEntries(i, j, new TreeMap<>(e.getValue()));
                }
            }
        }
        markedVertices.addAll(other.markedVertices);
    }

    public AttributeTags getAttributeTags() {
        return tags;
    }

    public String getName() {
        return name;
    }

    public Graph setName(String name) {
        this.name = name;
        return this;
    }

    public boolean isDirected() {
        return attributes.get(AttributeTags.DIRECTED).asBoolean();
    }

    public boolean isWeighted() {
        return attributes.get(AttributeTags.WEIGHTED).asBoolean();
    }

    /**
     * Change the directed flag of a graph without edges. Graphs with edges are converted with
     * {@link #makeDirected()} or {@link GraphTransforms#underlying(Graph)}.
     */
    public void setDirected(boolean directed) {
        if (directed != isDirected() && getEdgeCount() > 0) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "cannot change the directed flag of a graph with edges");
        }
        attributes.put(AttributeTags.DIRECTED, AttributeValue.of(directed));
    }

    public void setWeighted(boolean weighted) {
        if (!weighted) {
            makeUnweighted();
        } else {
            attributes.put(AttributeTags.WEIGHTED, AttributeValue.TRUE);
        }
    }

    /**
     * Replace every undirected edge by a pair of opposite arcs, each with its own attribute map.
     */
    public void makeDirected() {
        if (isDirected()) {
            return;
        }
        for (int i = 0; i < vertices.size(); i++) {
            TreeMap<Integer, Map<Integer, AttributeValue>> neighbors = vertices.get(i).getNeighbors();
            for (Map.Entry<Integer, Map<Integer, AttributeValue>> e : neighbors.entrySet()) {
                e.setValue(new TreeMap<>(e.getValue()));
            }
        }
        attributes.put(AttributeTags.DIRECTED, AttributeValue.TRUE);
    }

    /**
     * Make the graph weighted, taking edge weights from the given square matrix. The matrix of an undirected graph
     * must be symmetric.
     */
    public void makeWeighted(double[][] weights) {
        Objects.requireNonNull(weights);
        int n = vertices.size();
        if (weights.length != n) {
            throw new GraphException(GraphError.NOT_SQUARE_MATRIX, "expected " + n + " rows, got " + weights.length);
        }
        for (double[] row : weights) {
            if (row.length != n) {
                throw new GraphException(GraphError.NOT_SQUARE_MATRIX, "expected " + n + " columns, got " + row.length);
            }
        }
        if (!isDirected() && !GraphFactory.isSymmetric(weights)) {
            throw new GraphException(GraphError.MATRIX_NOT_SYMMETRIC);
        }
        attributes.put(AttributeTags.WEIGHTED, AttributeValue.TRUE);
        for (int i = 0; i < n; i++) {
            for (Map.Entry<Integer, Map<Integer, AttributeValue>> e : vertices.get(i).getNeighbors().entrySet()) {
                e.getValue().put(AttributeTags.WEIGHT, AttributeValue.of(weights[i][e.getKey()]));
            }
        }
    }

    public void makeUnweighted() {
        for (Vertex v : vertices) {
            v.getNeighbors().values().forEach(attr -> attr.remove(AttributeTags.WEIGHT));
        }
        attributes.put(AttributeTags.WEIGHTED, AttributeValue.FALSE);
    }

    /**
     * Give every edge of a weighted graph a random weight, uniformly drawn in [a, b) or, when integral, among the
     * integers of [a, b].
     */
    public void randomizeEdgeWeights(double a, double b, boolean integral, Random random) {
        Objects.requireNonNull(random);
        checkWeighted();
        if (a > b) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "empty weight interval [" + a + ", " + b + "]");
        }
        if (integral && (a != Math.rint(a) || b != Math.rint(b))) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "integral weight bounds expected, got " + a + " and " + b);
        }
        for (Edge e : getEdges()) {
            double weight = integral ? a + random.nextInt((int) (b - a) + 1) : a + (b - a) * random.nextDouble();
            setWeight(e.source(), e.target(), weight);
        }
        LOGGER.trace("Weights of {} edges randomized", getEdgeCount());
    }

    // vertices

    public int getVertexCount() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    /**
     * Add a vertex, or return the index of the existing vertex with the same label.
     */
    public int addVertex(String label) {
        Objects.requireNonNull(label);
        Integer existing = indicesByLabel.get(label);
        if (existing != null) {
            return existing;
        }
        int index = vertices.size();
        vertices.add(new Vertex(label));
        indicesByLabel.put(label, index);
        return index;
    }

    public void addVertices(Collection<String> labels) {
        Objects.requireNonNull(labels).forEach(this::addVertex);
    }

    /**
     * Add vertices labeled "0", "1", ..., "n-1" (shifted by the current vertex count).
     */
    public void addVertices(int count) {
        if (count < 0) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "negative vertex count " + count);
        }
        int first = vertices.size();
        for (int i = 0; i < count; i++) {
            String label = Integer.toString(first + i);
            while (indicesByLabel.containsKey(label)) {
                label = label + "'";
            }
            addVertex(label);
        }
    }

    /**
     * Remove a vertex with all its incident edges. Every vertex index greater than {@code i} is decremented.
     */
    public void removeVertex(int i) {
        Objects.checkIndex(i, vertices.size());
        for (Vertex v : vertices) {
            v.removeNeighbor(i);
        }
        Vertex removed = vertices.remove(i);
        indicesByLabel.remove(removed.getLabel());
        for (int k = i; k < vertices.size(); k++) {
            Vertex v = vertices.get(k);
            indicesByLabel.put(v.getLabel(), k);
        }
        for (Vertex v : vertices) {
            TreeMap<Integer, Map<Integer, AttributeValue>> neighbors = v.getNeighbors();
            SortedMap<Integer, Map<Integer, AttributeValue>> shifted = neighbors.tailMap(i);
            if (!shifted.isEmpty()) {
                Map<Integer, Map<Integer, AttributeValue>> moved = new TreeMap<>(shifted);
                shifted.clear();
                moved.forEach((j, attr) -> neighbors.put(j - 1, attr));
            }
        }
        markedVertices.removeIf(m -> m == i);
        markedVertices.replaceAll(m -> m > i ? m - 1 : m);
        LOGGER.trace("Vertex '{}' removed from graph {}", removed.getLabel(), this);
    }

    /**
     * @return true if a vertex with this label existed and has been removed
     */
    public boolean removeVertex(String label) {
        int i = getVertexIndex(label);
        if (i == NOT_FOUND) {
            return false;
        }
        removeVertex(i);
        return true;
    }

    public void removeVertices(Collection<String> labels) {
        for (String label : Objects.requireNonNull(labels)) {
            removeVertex(label);
        }
    }

    public String getVertexLabel(int i) {
        return getVertex(i).getLabel();
    }

    public List<String> getVertexLabels() {
        List<String> labels = new ArrayList<>(vertices.size());
        for (Vertex v : vertices) {
            labels.add(v.getLabel());
        }
        return labels;
    }

    public List<String> getVertexLabels(Collection<Integer> indices) {
        List<String> labels = new ArrayList<>(indices.size());
        for (int i : indices) {
            labels.add(getVertexLabel(i));
        }
        return labels;
    }

    public void setVertexLabel(int i, String label) {
        Objects.requireNonNull(label);
        Vertex v = getVertex(i);
        Integer existing = indicesByLabel.get(label);
        if (existing != null && existing != i) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "label '" + label + "' is already used by vertex " + existing);
        }
        indicesByLabel.remove(v.getLabel());
        v.setLabel(label);
        indicesByLabel.put(label, i);
    }

    /**
     * @return the index of the vertex with this label, or {@link #NOT_FOUND}
     */
    public int getVertexIndex(String label) {
        return indicesByLabel.getOrDefault(Objects.requireNonNull(label), NOT_FOUND);
    }

    /**
     * Same as {@link #getVertexIndex(String)} but fails with {@link GraphError#VERTEX_NOT_FOUND}.
     */
    public int requireVertexIndex(String label) {
        int i = getVertexIndex(label);
        if (i == NOT_FOUND) {
            throw new GraphException(GraphError.VERTEX_NOT_FOUND, label);
        }
        return i;
    }

    public boolean containsVertex(String label) {
        return indicesByLabel.containsKey(Objects.requireNonNull(label));
    }

    private Vertex getVertex(int i) {
        Objects.checkIndex(i, vertices.size());
        return vertices.get(i);
    }

    // edges

    private void addEdgeEntries(int i, int j, Map<Integer, AttributeValue> edgeAttributes) {
        vertices.get(i).addNeighbor(j, edgeAttributes);
        if (!isDirected()) {
            vertices.get(j).addNeighbor(i, edgeAttributes);
        }
    }

    /**
     * Add an edge (an arc if the graph is directed). Adding an existing edge leaves its attributes unchanged.
     */
    public void addEdge(int i, int j) {
        checkEdgeEnds(i, j);
        if (!vertices.get(i).hasNeighbor(j)) {
            Map<Integer, AttributeValue> edgeAttributes = new TreeMap<>();
            if (isWeighted()) {
                edgeAttributes.put(AttributeTags.WEIGHT, AttributeValue.of(1.0));
            }
            addEdgeEntries(i, j, edgeAttributes);
        }
    }

    /**
     * Add a weighted edge, or update the weight of an existing one.
     */
    public void addEdge(int i, int j, double weight) {
        checkWeighted();
        checkEdgeEnds(i, j);
        Map<Integer, AttributeValue> edgeAttributes = vertices.get(i).getEdgeAttributes(j);
        if (edgeAttributes == null) {
            edgeAttributes = new TreeMap<>();
            addEdgeEntries(i, j, edgeAttributes);
        }
        edgeAttributes.put(AttributeTags.WEIGHT, AttributeValue.of(weight));
    }

    /**
     * Add an edge between two labeled vertices, creating missing vertices.
     */
    public Edge addEdge(String label1, String label2) {
        int i = addVertex(label1);
        int j = addVertex(label2);
        addEdge(i, j);
        return new Edge(i, j);
    }

    public Edge addEdge(String label1, String label2, double weight) {
        checkWeighted();
        int i = addVertex(label1);
        int j = addVertex(label2);
        addEdge(i, j, weight);
        return new Edge(i, j);
    }

    private void checkEdgeEnds(int i, int j) {
        Objects.checkIndex(i, vertices.size());
        Objects.checkIndex(j, vertices.size());
        if (i == j) {
            throw new GraphException(GraphError.INVALID_EDGE, "self loop on vertex '" + vertices.get(i).getLabel() + "'");
        }
    }

    private void checkWeighted() {
        if (!isWeighted()) {
            throw new GraphException(GraphError.WEIGHTED_GRAPH_REQUIRED);
        }
    }

    /**
     * @return true if the edge existed and has been removed
     */
    public boolean removeEdge(int i, int j) {
        Objects.checkIndex(i, vertices.size());
        Objects.checkIndex(j, vertices.size());
        if (vertices.get(i).removeNeighbor(j) == null) {
            return false;
        }
        if (!isDirected()) {
            vertices.get(j).removeNeighbor(i);
        }
        return true;
    }

    public boolean removeEdge(String label1, String label2) {
        int i = getVertexIndex(label1);
        int j = getVertexIndex(label2);
        return i != NOT_FOUND && j != NOT_FOUND && removeEdge(i, j);
    }

    /**
     * @return true if there is an edge from i to j (in any direction if the graph is undirected)
     */
    public boolean hasEdge(int i, int j) {
        Objects.checkIndex(j, vertices.size());
        return getVertex(i).hasNeighbor(j);
    }

    public boolean hasEdge(String label1, String label2) {
        int i = getVertexIndex(label1);
        int j = getVertexIndex(label2);
        return i != NOT_FOUND && j != NOT_FOUND && hasEdge(i, j);
    }

    /**
     * @return true if there is an edge or an arc in any direction between i and j
     */
    public boolean areAdjacent(int i, int j) {
        return hasEdge(i, j) || hasEdge(j, i);
    }

    public int getEdgeCount() {
        int count = 0;
        for (Vertex v : vertices) {
            count += v.getNeighbors().size();
        }
        return isDirected() ? count : count / 2;
    }

    /**
     * Get all edges, each undirected edge being reported once with {@code source < target}.
     */
    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < vertices.size(); i++) {
            for (int j : vertices.get(i).getNeighbors().keySet()) {
                if (isDirected() || i < j) {
                    edges.add(new Edge(i, j));
                }
            }
        }
        return edges;
    }

    /**
     * Get the edges with at least one end in the given vertex set.
     */
    public List<Edge> getIncidentEdges(Collection<Integer> indices) {
        Set<Integer> set = new HashSet<>(indices);
        List<Edge> incident = new ArrayList<>();
        for (Edge e : getEdges()) {
            if (set.contains(e.source()) || set.contains(e.target())) {
                incident.add(e);
            }
        }
        return incident;
    }

    /**
     * Sorted out-neighbors of vertex i (all neighbors if the graph is undirected).
     */
    public int[] getNeighbors(int i) {
        return getVertex(i).getNeighborIndices();
    }

    /**
     * Sorted in-neighbors of vertex i (all neighbors if the graph is undirected).
     */
    public int[] getInNeighbors(int i) {
        Objects.checkIndex(i, vertices.size());
        if (!isDirected()) {
            return getNeighbors(i);
        }
        return vertices.stream().filter(v -> v.hasNeighbor(i)).mapToInt(v -> indicesByLabel.get(v.getLabel())).toArray();
    }

    /**
     * Sorted neighbors of vertex i ignoring arc directions.
     */
    public int[] getAdjacentVertices(int i) {
        if (!isDirected()) {
            return getNeighbors(i);
        }
        SortedSet<Integer> adjacent = new TreeSet<>(getVertex(i).getNeighbors().keySet());
        for (int j : getInNeighbors(i)) {
            adjacent.add(j);
        }
        return adjacent.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Snapshot of the out-neighbor lists, indexed like the vertices. Algorithms work on this snapshot.
     */
    public int[][] getAdjacencyLists() {
        int[][] adjacency = new int[vertices.size()][];
        for (int i = 0; i < vertices.size(); i++) {
            adjacency[i] = vertices.get(i).getNeighborIndices();
        }
        return adjacency;
    }

    /**
     * Snapshot of the neighbor lists ignoring arc directions.
     */
    public int[][] getUndirectedAdjacencyLists() {
        if (!isDirected()) {
            return getAdjacencyLists();
        }
        List<SortedSet<Integer>> sets = new ArrayList<>(vertices.size());
        for (int i = 0; i < vertices.size(); i++) {
            sets.add(new TreeSet<>());
        }
        for (int i = 0; i < vertices.size(); i++) {
            for (int j : vertices.get(i).getNeighbors().keySet()) {
                sets.get(i).add(j);
                sets.get(j).add(i);
            }
        }
        int[][] adjacency = new int[vertices.size()][];
        for (int i = 0; i < vertices.size(); i++) {
            adjacency[i] = sets.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return adjacency;
    }

    // degrees

    public int getOutDegree(int i) {
        return getVertex(i).getNeighbors().size();
    }

    public int getInDegree(int i) {
        Objects.checkIndex(i, vertices.size());
        if (!isDirected()) {
            return getOutDegree(i);
        }
        int count = 0;
        for (Vertex v : vertices) {
            if (v.hasNeighbor(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of incident edges; for a directed graph, the sum of in and out degrees.
     */
    public int getDegree(int i) {
        return isDirected() ? getInDegree(i) + getOutDegree(i) : getOutDegree(i);
    }

    public int[] getDegreeSequence() {
        int[] degrees = new int[vertices.size()];
        for (int i = 0; i < degrees.length; i++) {
            degrees[i] = getDegree(i);
        }
        return degrees;
    }

    public int getMinimumDegree() {
        checkNotEmpty();
        return Arrays.stream(getDegreeSequence()).min().orElseThrow();
    }

    public int getMaximumDegree() {
        checkNotEmpty();
        return Arrays.stream(getDegreeSequence()).max().orElseThrow();
    }

    public boolean isRegular(int d) {
        return Arrays.stream(getDegreeSequence()).allMatch(deg -> deg == d);
    }

    private void checkNotEmpty() {
        if (vertices.isEmpty()) {
            throw new GraphException(GraphError.GRAPH_IS_EMPTY);
        }
    }

    // weights

    /**
     * @return the weight of edge (i, j), 1 if the graph is unweighted
     */
    public double getWeight(int i, int j) {
        Map<Integer, AttributeValue> edgeAttributes = requireEdgeAttributes(i, j);
        AttributeValue w = edgeAttributes.get(AttributeTags.WEIGHT);
        return isWeighted() && w != null && w.isNumber() ? w.asNumber() : 1.0;
    }

    public void setWeight(int i, int j, double weight) {
        checkWeighted();
        requireEdgeAttributes(i, j).put(AttributeTags.WEIGHT, AttributeValue.of(weight));
    }

    private Map<Integer, AttributeValue> requireEdgeAttributes(int i, int j) {
        Objects.checkIndex(j, vertices.size());
        Map<Integer, AttributeValue> edgeAttributes = getVertex(i).getEdgeAttributes(j);
        if (edgeAttributes == null) {
            throw new GraphException(GraphError.EDGE_NOT_FOUND, "(" + getVertexLabel(i) + ", " + getVertexLabel(j) + ")");
        }
        return edgeAttributes;
    }

    // attributes

    private static void checkNotReserved(int key) {
        if (key == AttributeTags.DIRECTED || key == AttributeTags.WEIGHTED) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "directed and weighted flags are changed through dedicated methods");
        }
    }

    public Optional<AttributeValue> getGraphAttribute(int key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Optional<AttributeValue> getGraphAttribute(String tag) {
        int key = tags.getKey(tag);
        return key < 0 ? Optional.empty() : getGraphAttribute(key);
    }

    public void setGraphAttribute(int key, AttributeValue value) {
        checkNotReserved(key);
        attributes.put(key, Objects.requireNonNull(value));
    }

    public void setGraphAttribute(String tag, AttributeValue value) {
        setGraphAttribute(tags.register(tag), value);
    }

    public boolean discardGraphAttribute(int key) {
        checkNotReserved(key);
        return attributes.remove(key) != null;
    }

    public Map<String, AttributeValue> getGraphAttributes() {
        return toTagMap(attributes);
    }

    public Optional<AttributeValue> getVertexAttribute(int i, int key) {
        return Optional.ofNullable(getVertex(i).getAttributes().get(key));
    }

    public Optional<AttributeValue> getVertexAttribute(int i, String tag) {
        int key = tags.getKey(tag);
        return key < 0 ? Optional.empty() : getVertexAttribute(i, key);
    }

    public void setVertexAttribute(int i, int key, AttributeValue value) {
        getVertex(i).getAttributes().put(key, Objects.requireNonNull(value));
    }

    public void setVertexAttribute(int i, String tag, AttributeValue value) {
        setVertexAttribute(i, tags.register(tag), value);
    }

    public boolean discardVertexAttribute(int i, int key) {
        return getVertex(i).getAttributes().remove(key) != null;
    }

    public Map<String, AttributeValue> getVertexAttributes(int i) {
        return toTagMap(getVertex(i).getAttributes());
    }

    public Optional<AttributeValue> getEdgeAttribute(int i, int j, int key) {
        return Optional.ofNullable(requireEdgeAttributes(i, j).get(key));
    }

    public Optional<AttributeValue> getEdgeAttribute(int i, int j, String tag) {
        int key = tags.getKey(tag);
        return key < 0 ? Optional.empty() : getEdgeAttribute(i, j, key);
    }

    public void setEdgeAttribute(int i, int j, int key, AttributeValue value) {
        Objects.requireNonNull(value);
        if (key == AttributeTags.WEIGHT) {
            setWeight(i, j, value.asNumber());
        } else {
            requireEdgeAttributes(i, j).put(key, value);
        }
    }

    public void setEdgeAttribute(int i, int j, String tag, AttributeValue value) {
        setEdgeAttribute(i, j, tags.register(tag), value);
    }

    public boolean discardEdgeAttribute(int i, int j, int key) {
        if (key == AttributeTags.WEIGHT && isWeighted()) {
            throw new GraphException(GraphError.INVALID_ARGUMENT, "weights of a weighted graph cannot be discarded");
        }
        return requireEdgeAttributes(i, j).remove(key) != null;
    }

    public Map<String, AttributeValue> getEdgeAttributes(int i, int j) {
        return toTagMap(requireEdgeAttributes(i, j));
    }

    private Map<String, AttributeValue> toTagMap(Map<Integer, AttributeValue> attr) {
        Map<String, AttributeValue> result = new LinkedHashMap<>();
        attr.forEach((key, value) -> result.put(tags.getTag(key), value));
        return result;
    }

    // matrices

    public DenseMatrix getAdjacencyMatrix() {
        int n = vertices.size();
        DenseMatrix m = new DenseMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j : vertices.get(i).getNeighbors().keySet()) {
                m.set(i, j, 1);
            }
        }
        return m;
    }

    public DenseMatrix getWeightMatrix() {
        checkWeighted();
        int n = vertices.size();
        DenseMatrix m = new DenseMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j : vertices.get(i).getNeighbors().keySet()) {
                m.set(i, j, getWeight(i, j));
            }
        }
        return m;
    }

    /**
     * Vertex/edge incidence matrix, edges ordered as in {@link #getEdges()}. For a directed graph, the source of an
     * arc gets -1 and its target +1.
     */
    public DenseMatrix getIncidenceMatrix() {
        List<Edge> edges = getEdges();
        DenseMatrix m = new DenseMatrix(vertices.size(), edges.size());
        for (int k = 0; k < edges.size(); k++) {
            Edge e = edges.get(k);
            m.set(e.source(), k, isDirected() ? -1 : 1);
            m.set(e.target(), k, 1);
        }
        return m;
    }

    // marked vertices

    public void markVertex(int i) {
        Objects.checkIndex(i, vertices.size());
        if (!markedVertices.contains(i)) {
            markedVertices.add(i);
        }
    }

    public boolean unmarkVertex(int i) {
        return markedVertices.remove(Integer.valueOf(i));
    }

    public List<Integer> getMarkedVertices() {
        return Collections.unmodifiableList(markedVertices);
    }

    public void clearMarkedVertices() {
        markedVertices.clear();
    }

    @Override
    public String toString() {
        return (name != null ? name : "graph") + "[" + (isDirected() ? "directed" : "undirected") + ", "
                + (isWeighted() ? "weighted" : "unweighted") + ", " + vertices.size() + " vertices, " + getEdgeCount() + " edges]";
    }
}
