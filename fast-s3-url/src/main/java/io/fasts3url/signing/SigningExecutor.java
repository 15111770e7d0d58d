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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import jakarta.annotation.PreDestroy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.google.common.util.concurrent.MoreExecutors.shutdownAndAwaitTermination;

/**
 * Owns the worker pool used for parallel signing, when {@code bucket-url-signer.parallel.threads}
 * enables one, and shuts it down with the application.
 */
public class SigningExecutor
{
    private static final Logger log = Logger.get(SigningExecutor.class);

    public static final String THREAD_NAME_PREFIX = "bucket-url-signer-";

    private final Optional<ExecutorService> executorService;
    private final Optional<ParallelSigning> parallelSigning;

    @Inject
    public SigningExecutor(BucketUrlSignerConfig config)
    {
        int threads = config.getParallelThreads();
        if (threads > 0) {
            log.info("Signing batches of %s keys or more with %s threads", config.getParallelMinBatchSize(), threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder().setDaemon(true).setNameFormat(THREAD_NAME_PREFIX + "%s").build());
            executorService = Optional.of(executor);
            parallelSigning = Optional.of(new ParallelSigning(executor, threads, config.getParallelMinBatchSize()));
        }
        else {
            executorService = Optional.empty();
            parallelSigning = Optional.empty();
        }
    }

    public Optional<ParallelSigning> parallelSigning()
    {
        return parallelSigning;
    }

    @PreDestroy
    public void shutDown()
    {
        executorService.ifPresent(executor -> {
            if (!shutdownAndAwaitTermination(executor, Duration.ofSeconds(30))) {
                log.warn("Could not shutdown signing executor");
            }
        });
    }
}
