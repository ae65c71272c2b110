/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.dynamis.builder.parser.util;

import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;

public class AstUtils {

    private static final int MAX_DESCRIPTION_LENGTH = 60;

    private AstUtils() {
    }

    /**
     * Short, single-line description of a node for diagnostics: its first source line, truncated,
     * followed by its position when the node came from parsed source.
     */
    public static String describe(Node node) {
        String text = node.toString().trim();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline).trim() + " ...";
        }
        if (text.length() > MAX_DESCRIPTION_LENGTH) {
            text = text.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
        }
        String shown = text;
        return node.getBegin()
                .map(begin -> shown + " at " + position(begin))
                .orElse(shown);
    }

    private static String position(Position begin) {
        return "line " + begin.line + ", column " + begin.column;
    }

    /** True if {@code node} or a descendant reached only through nodes accepted by {@code descend} is a {@code nodeType}. */
    public static boolean hasChildOfType(Node node, Class<?> nodeType, Predicate<Node> descend) {
        if (nodeType.isInstance(node)) {
            return true;
        }
        for (Node child : node.getChildNodes()) {
            if (descend.test(child) && hasChildOfType(child, nodeType, descend)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The statements of a block, or the statement itself when it is not a block. The result is a
     * read-only view; wrapping in a {@link com.github.javaparser.ast.NodeList} would re-parent the node.
     */
    public static List<Statement> statementsOf(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return Collections.unmodifiableList(block.getStatements());
        }
        return List.of(statement);
    }
}
