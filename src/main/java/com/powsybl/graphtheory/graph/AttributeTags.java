/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.graphtheory.graph;

import java.util.*;

/**
 * Registry mapping attribute tag names to small integer keys.
 * <p>
 * Keys below {@link #USER} are reserved for the built-in tags. A registry belongs to one graph and is copied along
 * with it by every transformation, so that user tags keep their keys across a family of derived graphs.
 *
 * @author PowSyBl graph theory team
 */
public class AttributeTags {

    public static final int WEIGHT = 0;
    public static final int COLOR = 1;
    public static final int DIRECTED = 2;
    public static final int WEIGHTED = 3;
    public static final int POSITION = 4;
    public static final int USER = 5;

    private static final List<String> BUILT_IN_TAGS = List.of("weight", "color", "directed", "weighted", "pos");

    private final List<String> userTags = new ArrayList<>();

    private final Map<String, Integer> keysByTag = new HashMap<>();

    public AttributeTags() {
        for (int i = 0; i < BUILT_IN_TAGS.size(); i++) {
            keysByTag.put(BUILT_IN_TAGS.get(i), i);
        }
    }

    public AttributeTags(AttributeTags other) {
        this();
        Objects.requireNonNull(other);
        other.userTags.forEach(this::register);
    }

    /**
     * Get the key of a tag, registering it first if needed.
     */
    public int register(String tag) {
        Objects.requireNonNull(tag);
        Integer key = keysByTag.get(tag);
        if (key == null) {
            key = USER + userTags.size();
            userTags.add(tag);
            keysByTag.put(tag, key);
        }
        return key;
    }

    /**
     * @return the key of the tag or -1 if the tag has never been registered
     */
    public int getKey(String tag) {
        Objects.requireNonNull(tag);
        return keysByTag.getOrDefault(tag, -1);
    }

    public String getTag(int key) {
        if (key >= 0 && key < USER) {
            return BUILT_IN_TAGS.get(key);
        }
        int i = key - USER;
        if (i < 0 || i >= userTags.size()) {
            throw new IllegalArgumentException("Unknown attribute key: " + key);
        }
        return userTags.get(i);
    }

    public List<String> getUserTags() {
        return Collections.unmodifiableList(userTags);
    }
}
