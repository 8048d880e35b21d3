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

package dev.mars.cyclus.workflow.task;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Standard task output names, their accepted aliases and their ordering.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class TaskOutputNames {

    public static final String EXPIRED = "expired";
    public static final String SUBMITTED = "submitted";
    public static final String SUBMIT_FAILED = "submit-failed";
    public static final String STARTED = "started";
    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";

    /** Derived only: succeeded or failed. Never registered as an output. */
    public static final String FINISHED = "finished";

    /** Fixed order used for sorting. */
    public static final List<String> STANDARD_OUTPUTS =
            List.of(EXPIRED, SUBMITTED, SUBMIT_FAILED, STARTED, SUCCEEDED, FAILED);

    private static final Map<String, String> ALT_QUALIFIERS = Map.of(
            "expire", EXPIRED,
            "submit", SUBMITTED,
            "submit-fail", SUBMIT_FAILED,
            "start", STARTED,
            "succeed", SUCCEEDED,
            "fail", FAILED,
            "finish", FINISHED
    );

    /**
     * Standard outputs first in their fixed order, then custom outputs alphabetically.
     */
    public static final Comparator<String> OUTPUT_ORDER = (a, b) -> {
        int ia = STANDARD_OUTPUTS.indexOf(a);
        int ib = STANDARD_OUTPUTS.indexOf(b);
        if (ia >= 0 && ib >= 0) {
            return Integer.compare(ia, ib);
        }
        if (ia >= 0) {
            return -1;
        }
        if (ib >= 0) {
            return 1;
        }
        return a.compareTo(b);
    };

    private TaskOutputNames() {
    }

    /**
     * Replaces a qualifier alias ({@code fail}) with its standard name
     * ({@code failed}); anything else is returned unchanged.
     */
    public static String standardise(String qualifier) {
        return ALT_QUALIFIERS.getOrDefault(qualifier, qualifier);
    }

    public static boolean isStandard(String output) {
        return STANDARD_OUTPUTS.contains(output);
    }

    /**
     * Returns the output whose optionality must agree with {@code output},
     * or {@code null} if it has none.
     */
    public static String opposite(String output) {
        switch (output) {
            case SUCCEEDED:
                return FAILED;
            case FAILED:
                return SUCCEEDED;
            case SUBMITTED:
                return SUBMIT_FAILED;
            case SUBMIT_FAILED:
                return SUBMITTED;
            default:
                return null;
        }
    }

    /**
     * The identifier an output is known by in completion expressions.
     */
    public static String toCompletionVariable(String output) {
        return output.replace('-', '_');
    }
}
