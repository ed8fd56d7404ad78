/*
 * Copyright DataStax, Inc.
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

package io.github.jbellis.tagscope.harness;

import java.util.Optional;

/**
 * Either a completed {@link BenchmarkReport} or the reason the comparison could not run.
 * The harness reports configuration problems through this value instead of throwing.
 */
public final class BenchmarkOutcome {
    private final BenchmarkReport report;
    private final String failure;

    private BenchmarkOutcome(BenchmarkReport report, String failure) {
        this.report = report;
        this.failure = failure;
    }

    static BenchmarkOutcome completed(BenchmarkReport report) {
        return new BenchmarkOutcome(report, null);
    }

    static BenchmarkOutcome invalid(String failure) {
        return new BenchmarkOutcome(null, failure);
    }

    public boolean isSuccess() {
        return report != null;
    }

    public Optional<BenchmarkReport> getReport() {
        return Optional.ofNullable(report);
    }

    /**
     * @return the failure message, empty on success
     */
    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "BenchmarkOutcome[" + report.getVerdict() + "]" : "BenchmarkOutcome[" + failure + "]";
    }
}
