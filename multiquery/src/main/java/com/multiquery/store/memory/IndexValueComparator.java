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

package com.multiquery.store.memory;

import com.multiquery.common.utils.NumberUtils;
import com.multiquery.store.StoreException;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Value ordering of the two secondary index types, chosen by the index name suffix.
 */
enum IndexValueComparator implements Comparator<Object> {
    BIN {
        @Override
        Object normalize(String index, Object value) {
            if (value instanceof CharSequence cs) {
                return cs.toString();
            }
            throw new StoreException(String.format("Index %s only accepts strings, got %s", index, describe(value)));
        }

        @Override
        public int compare(Object left, Object right) {
            return ((String) left).compareTo((String) right);
        }

        @Override
        boolean isOpenUpperBound(Object end) {
            return "".equals(end);
        }
    },
    INT {
        @Override
        Object normalize(String index, Object value) {
            BigDecimal number = NumberUtils.toBigDecimal(value);
            if (number == null) {
                throw new StoreException(String.format("Index %s only accepts integers, got %s", index, describe(value)));
            }
            return number;
        }

        @Override
        public int compare(Object left, Object right) {
            return ((BigDecimal) left).compareTo((BigDecimal) right);
        }

        @Override
        boolean isOpenUpperBound(Object end) {
            return false;
        }
    };

    static IndexValueComparator forIndex(String index) {
        if (index.endsWith("_bin")) {
            return BIN;
        }
        if (index.endsWith("_int")) {
            return INT;
        }
        throw new StoreException(String.format("Unknown index type: %s, index names must end with _bin or _int", index));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Validates a value for this index type and converts it to the form it is compared in.
     */
    abstract Object normalize(String index, Object value);

    /**
     * Text ranges use an empty string as the open upper bound.
     */
    abstract boolean isOpenUpperBound(Object end);
}
