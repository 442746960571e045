/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch;

import com.bulkinstaller.packagemanager.models.PackageAction;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BatchExitCodeTest {

    @Test
    void GIVEN_results_WHEN_classified_THEN_exit_code_reflects_outcome() {
        assertEquals(BatchExitCode.SUCCESS, BatchExitCode.of(null));
        assertEquals(BatchExitCode.SUCCESS, BatchExitCode.of(Collections.emptyList()));
        assertEquals(BatchExitCode.SUCCESS, BatchExitCode.of(Arrays.asList(result(ProcessStatus.SUCCESS),
                result(ProcessStatus.SUCCESS))));
        assertEquals(BatchExitCode.PARTIAL_FAILURE, BatchExitCode.of(Arrays.asList(result(ProcessStatus.SUCCESS),
                result(ProcessStatus.INCOMPATIBLE))));
        assertEquals(BatchExitCode.FAILURE, BatchExitCode.of(Arrays.asList(result(ProcessStatus.FAILED),
                result(ProcessStatus.INCOMPATIBLE))));
    }

    private static ProcessResult result(ProcessStatus status) {
        return ProcessResult.builder().slug("p").action(PackageAction.INSTALL).status(status).build();
    }
}
