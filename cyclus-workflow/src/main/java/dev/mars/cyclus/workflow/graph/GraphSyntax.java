/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.cyclus.workflow.graph;

import java.util.regex.Pattern;

/**
 * Tokens and patterns of the graph language.
 *
 * <p>A node is {@code NAME(<PARAMS>)([OFFSET])(:QUALIFIER)(?)}, optionally
 * prefixed by {@code !} (suicide, right side only) or written as an
 * {@code @xtrigger} action.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class GraphSyntax {

    public static final String OP_AND = "&";
    public static final String OP_OR = "|";
    public static final String OP_AND_ERR = "&&";
    public static final String OP_OR_ERR = "||";
    public static final String SUICIDE = "!";
    public static final String OPTIONAL = "?";
    public static final String TRIGGER = ":";
    public static final String ARROW = "=>";
    public static final String ACTION = "@";

    public static final String NAME = "\\w[\\w\\-+%@]*";
    public static final String NAME_SUFFIX = "[\\w\\-+%@]+";

    static final String PARAMS = "<[\\w,=\\-+]+>";
    static final String OFFSET = "\\[[\\w\\-\\+\\^:]+\\]";
    static final String QUALIFIER = ":[\\w\\-]+";

    /** Parameter expansion marker for nodes whose offset parameter is out of range. */
    public static final String REMOVE_MARKER = "-32768";

    /** Two names separated only by whitespace, e.g. {@code foo bar => baz}. */
    static final Pattern BAD_SPACES = Pattern.compile(
            NAME + "(?:(?<![\\-+])|(?!\\s*[0-9]))(?!\\s*[\\-+]\\s*[0-9])\\s+" + NAME_SUFFIX);

    static final Pattern COMMENT = Pattern.compile("#.*$");

    static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Pattern ACTION_TOKEN = Pattern.compile("@[\\w\\-+%]+");

    static final Pattern PARAMS_PRESENT = Pattern.compile(PARAMS);

    /** One complete node, used to validate node format. */
    static final Pattern NODE_FULL = Pattern.compile(
            "!?(?:(?:" + NAME + "(?:" + PARAMS + ")?|" + PARAMS + "))+"
                    + "(?:" + OFFSET + ")?(?:" + QUALIFIER + ")?\\??");

    /** Nodes and actions in a left-side expression: name, offset, qualifier, optional marker. */
    static final Pattern NODES = Pattern.compile(
            "((?:[!@])?" + NAME + ")(" + OFFSET + ")?(" + QUALIFIER + ")?(\\??)");

    /** A right-side node: suicide marker, name, qualifier, optional marker. */
    static final Pattern RHS_NODE = Pattern.compile(
            "(!)?(" + NAME + ")(" + QUALIFIER + ")?(\\??)");

    /** {@code local<workflow::task:status>} inter-workflow polling annotation. */
    static final Pattern WORKFLOW_STATE = Pattern.compile(
            "(" + NAME + ")(<([\\w.\\-/]+)::(" + NAME + ")(" + QUALIFIER + ")?>)");

    private static final String TASK_NAME_PART = "[^\\s&|]";
    private static final String REMOVE_TOKEN = TASK_NAME_PART + "*" + REMOVE_MARKER + TASK_NAME_PART + "*";

    /** A node carrying the removal marker together with its adjoining operator. */
    static final Pattern NODE_OUT_OF_RANGE = Pattern.compile(
            "(?:^" + REMOVE_TOKEN + "[&|]|[&|]" + REMOVE_TOKEN + "|^" + REMOVE_TOKEN + "$)");

    static final String NODE_FORMAT_USAGE = "Correct format is:\n"
            + " @ACTION or  NAME(<PARAMS>)([CYCLE-POINT-OFFSET])(:TRIGGER)(?)\n"
            + " {NAME(<PARAMS>) can also be: <PARAMS>NAME or NAME<PARAMS>NAME_CONTINUED}\n"
            + " or\n"
            + " NAME(<REMOTE-WORKFLOW-TRIGGER>)(:TRIGGER)";

    private GraphSyntax() {
    }

    /**
     * Message listing badly formatted lines followed by the node format usage.
     */
    static String badNodeFormat(Iterable<String> lines) {
        return "bad graph node format:\n  " + String.join("\n  ", lines) + "\n" + NODE_FORMAT_USAGE;
    }
}
