/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.multiquery.predicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.bson.Document;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical AND of its children, evaluated left to right with short-circuit.
 */
public record ConjunctionPredicate(List<DocumentPredicate> children) implements DocumentPredicate {

    public ConjunctionPredicate {
        Preconditions.checkArgument(!children.isEmpty(), "conjunction requires at least one predicate");
        children = ImmutableList.copyOf(children);
    }

    @Override
    public boolean test(Document document) {
        for (DocumentPredicate child : children) {
            if (!child.test(document)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String expression() {
        return children.stream().map(DocumentPredicate::expression).collect(Collectors.joining(" && "));
    }
}
