/*
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
package io.fasts3url.signing;

import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Spreads the per-key signing of large batches over {@code executor}. Batches with fewer
 * than {@code minBatchSize} keys are signed on the calling thread.
 */
public record ParallelSigning(Executor executor, int parallelism, int minBatchSize)
{
    public ParallelSigning
    {
        requireNonNull(executor, "executor is null");
        checkArgument(parallelism > 0, "parallelism must be positive");
        checkArgument(minBatchSize > 0, "minBatchSize must be positive");
    }

    boolean appliesTo(int batchSize)
    {
        return parallelism > 1 && batchSize >= minBatchSize;
    }
}
