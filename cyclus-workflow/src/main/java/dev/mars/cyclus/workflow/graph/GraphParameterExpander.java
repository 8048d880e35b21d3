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

import dev.mars.cyclus.workflow.ParameterExpansionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameter expansion of graph lines.
 *
 * <p>Each parameter has an ordered list of values and a name template such
 * as {@code _m%(m)s} or {@code _m%(m)02d}. A group {@code <m,n>} is replaced
 * by the concatenated templates of its parameters, for every combination of
 * the values of the parameters used in the line. Within a group a
 * parameter may be pinned ({@code <m=2>}) or offset by index
 * ({@code <m-1>}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphParameterExpander implements ParameterExpander {

    private static final Logger logger = Logger.getLogger(GraphParameterExpander.class.getName());

    private static final Pattern GROUP = Pattern.compile("<(.*?)>");
    private static final Pattern ITEM = Pattern.compile("(\\w+)\\s*([\\-+]\\s*\\d+|=\\s*" + GraphSyntax.NAME_SUFFIX + ")?");
    private static final Pattern TEMPLATE_FIELD = Pattern.compile("%\\((\\w+)\\)(s|0?(\\d*)d)");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final Map<String, List<String>> values;
    private final Map<String, String> templates;
    private final int maxLines;

    /**
     * @param values parameter values in order, keyed by parameter name
     * @param templates name templates keyed by parameter name; missing
     *        templates get the default form
     * @param maxLines upper bound on the lines produced from one line
     */
    public GraphParameterExpander(Map<String, List<String>> values, Map<String, String> templates, int maxLines) {
        this.values = new LinkedHashMap<>();
        this.templates = new LinkedHashMap<>();
        this.maxLines = maxLines;
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            List<String> list = List.copyOf(entry.getValue());
            this.values.put(entry.getKey(), list);
            String template = templates == null ? null : templates.get(entry.getKey());
            this.templates.put(entry.getKey(), template != null ? template : defaultTemplate(entry.getKey(), list));
        }
        if (templates != null) {
            templates.forEach(this.templates::putIfAbsent);
        }
    }

    /**
     * {@code _name%(name)0Nd} for integer parameters, N being the widest
     * value, otherwise {@code _%(name)s}.
     */
    static String defaultTemplate(String name, List<String> values) {
        if (!values.isEmpty() && values.stream().allMatch(v -> INTEGER.matcher(v).matches())) {
            int width = values.stream().mapToInt(String::length).max().orElse(1);
            return "_" + name + "%(" + name + ")0" + width + "d";
        }
        return "_%(" + name + ")s";
    }

    public Map<String, String> getTemplates() {
        return Collections.unmodifiableMap(templates);
    }

    @Override
    public List<String> expand(String line) throws ParameterExpansionException {
        Set<String> groups = new LinkedHashSet<>();
        Matcher matcher = GROUP.matcher(line);
        while (matcher.find()) {
            groups.add(matcher.group(1));
        }
        List<String> used = new ArrayList<>();
        for (String group : groups) {
            for (String item : group.split(",", -1)) {
                Matcher m = ITEM.matcher(item.trim());
                boolean matched = m.lookingAt();
                String name = matched ? m.group(1) : item.trim();
                List<String> list = values.get(name);
                if (list == null || list.isEmpty()) {
                    throw new ParameterExpansionException(
                            "parameter " + name + " is not defined in <" + group + ">: " + line);
                }
                String offset = matched ? m.group(2) : null;
                if (offset != null && offset.startsWith("=")) {
                    String value = offset.substring(1).trim();
                    if (!containsValue(list, value)) {
                        throw new ParameterExpansionException("parameter " + name + " out of range: " + group);
                    }
                }
                if (!used.contains(name)) {
                    used.add(name);
                }
            }
        }
        long combinations = 1;
        for (String name : used) {
            combinations *= values.get(name).size();
            if (combinations > maxLines) {
                throw new ParameterExpansionException("parameter expansion of line exceeds "
                        + maxLines + " lines: " + line);
            }
        }
        Set<String> result = new LinkedHashSet<>();
        expand(line, groups, used, 0, new LinkedHashMap<>(), result);
        logger.fine(() -> "Expanded '" + line + "' into " + result.size() + " line(s)");
        return new ArrayList<>(result);
    }

    private void expand(String line, Set<String> groups, List<String> used, int index,
                        Map<String, String> current, Set<String> result) throws ParameterExpansionException {
        if (index < used.size()) {
            String name = used.get(index);
            for (String value : values.get(name)) {
                current.put(name, value);
                expand(line, groups, used, index + 1, current, result);
            }
            return;
        }
        String expanded = line;
        for (String group : groups) {
            Map<String, String> groupValues = new LinkedHashMap<>();
            for (String item : group.split(",", -1)) {
                Matcher m = ITEM.matcher(item.trim());
                if (!m.lookingAt()) {
                    throw new ParameterExpansionException("parameter " + item + " is not defined in <" + group + ">: " + line);
                }
                String name = m.group(1);
                String offset = m.group(2) == null ? null : m.group(2).replaceAll("\\s", "");
                if (offset == null) {
                    groupValues.put(name, current.get(name));
                } else if (offset.startsWith("=")) {
                    groupValues.put(name, offset.substring(1));
                } else {
                    List<String> list = values.get(name);
                    int offsetIndex = list.indexOf(current.get(name)) + Integer.parseInt(offset.replace("+", ""));
                    groupValues.put(name, offsetIndex >= 0 && offsetIndex < list.size()
                            ? list.get(offsetIndex) : GraphSyntax.REMOVE_MARKER);
                }
            }
            StringBuilder template = new StringBuilder();
            for (String name : groupValues.keySet()) {
                template.append(templates.get(name));
            }
            expanded = expanded.replace("<" + group + ">", substitute(template.toString(), groupValues));
        }
        if (!expanded.isEmpty()) {
            result.add(expanded);
        }
    }

    private static String substitute(String template, Map<String, String> groupValues) throws ParameterExpansionException {
        Matcher matcher = TEMPLATE_FIELD.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = groupValues.get(name);
            if (value == null) {
                throw new ParameterExpansionException("parameter " + name + " is not defined.");
            }
            String replacement = value;
            if (!"s".equals(matcher.group(2)) && !GraphSyntax.REMOVE_MARKER.equals(value)) {
                if (!INTEGER.matcher(value).matches()) {
                    throw new ParameterExpansionException("parameter " + name + " value " + value + " is not an integer");
                }
                String width = matcher.group(3);
                replacement = width == null || width.isEmpty()
                        ? value
                        : String.format("%0" + width + "d", Integer.parseInt(value));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static boolean containsValue(List<String> list, String value) {
        for (String candidate : list) {
            if (Objects.equals(candidate, value)) {
                return true;
            }
            if (INTEGER.matcher(candidate).matches() && INTEGER.matcher(value).matches()
                    && Integer.parseInt(candidate) == Integer.parseInt(value)) {
                return true;
            }
        }
        return false;
    }
}
