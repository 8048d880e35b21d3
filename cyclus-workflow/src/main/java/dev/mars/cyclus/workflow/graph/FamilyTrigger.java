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

import dev.mars.cyclus.workflow.task.TaskOutputNames;

/**
 * The legal family trigger qualifiers.
 *
 * <p>On the left of an arrow a family trigger expands to the member output
 * of every member, combined with AND ({@code -all}) or OR ({@code -any}).
 * On the right it implies the optionality of one output of every member.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum FamilyTrigger {

    START_ALL("start-all", TaskOutputNames.STARTED, true, TaskOutputNames.STARTED, false),
    START_ANY("start-any", TaskOutputNames.STARTED, false, TaskOutputNames.STARTED, false),
    SUCCEED_ALL("succeed-all", TaskOutputNames.SUCCEEDED, true, TaskOutputNames.SUCCEEDED, false),
    SUCCEED_ANY("succeed-any", TaskOutputNames.SUCCEEDED, false, TaskOutputNames.SUCCEEDED, true),
    FAIL_ALL("fail-all", TaskOutputNames.FAILED, true, TaskOutputNames.FAILED, false),
    FAIL_ANY("fail-any", TaskOutputNames.FAILED, false, TaskOutputNames.FAILED, true),
    SUBMIT_ALL("submit-all", TaskOutputNames.SUBMITTED, true, TaskOutputNames.SUBMITTED, false),
    SUBMIT_ANY("submit-any", TaskOutputNames.SUBMITTED, false, TaskOutputNames.SUBMITTED, true),
    SUBMIT_FAIL_ALL("submit-fail-all", TaskOutputNames.SUBMIT_FAILED, true, TaskOutputNames.SUBMIT_FAILED, false),
    SUBMIT_FAIL_ANY("submit-fail-any", TaskOutputNames.SUBMIT_FAILED, false, TaskOutputNames.SUBMIT_FAILED, true),
    FINISH_ALL("finish-all", TaskOutputNames.FINISHED, true, TaskOutputNames.SUCCEEDED, true),
    FINISH_ANY("finish-any", TaskOutputNames.FINISHED, false, TaskOutputNames.SUCCEEDED, true);

    private final String qualifier;
    private final String memberOutput;
    private final boolean all;
    private final String impliedOutput;
    private final boolean impliedOptional;

    FamilyTrigger(String qualifier, String memberOutput, boolean all, String impliedOutput, boolean impliedOptional) {
        this.qualifier = qualifier;
        this.memberOutput = memberOutput;
        this.all = all;
        this.impliedOutput = impliedOutput;
        this.impliedOptional = impliedOptional;
    }

    public String getQualifier() {
        return qualifier;
    }

    /** The member output a left-side family trigger waits for. */
    public String getMemberOutput() {
        return memberOutput;
    }

    public boolean isAll() {
        return all;
    }

    /** The member output whose optionality a right-side family trigger implies. */
    public String getImpliedOutput() {
        return impliedOutput;
    }

    public boolean isImpliedOptional() {
        return impliedOptional;
    }

    /**
     * Returns the family trigger for {@code qualifier}, or {@code null} if it is not one.
     */
    public static FamilyTrigger fromQualifier(String qualifier) {
        if (qualifier == null) {
            return null;
        }
        for (FamilyTrigger trigger : values()) {
            if (trigger.qualifier.equals(qualifier)) {
                return trigger;
            }
        }
        return null;
    }
}
