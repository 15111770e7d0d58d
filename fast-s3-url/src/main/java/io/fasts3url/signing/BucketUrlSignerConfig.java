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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

public class BucketUrlSignerConfig
{
    private String endpoint;
    private Optional<String> region = Optional.empty();
    private Duration defaultExpiry = new Duration(1, TimeUnit.HOURS);
    private int parallelThreads;
    private int parallelMinBatchSize = 10_000;

    @NotNull
    public String getEndpoint()
    {
        return endpoint;
    }

    @Config("bucket-url-signer.endpoint")
    @ConfigDescription("Bucket endpoint URL, virtual-hosted (https://my-bucket.s3.amazonaws.com/) or path style (https://s3.amazonaws.com/my-bucket/)")
    public BucketUrlSignerConfig setEndpoint(String endpoint)
    {
        this.endpoint = endpoint;
        return this;
    }

    @NotNull
    public Optional<String> getRegion()
    {
        return region;
    }

    @Config("bucket-url-signer.region")
    @ConfigDescription("Region to sign for, defaults to us-east-1")
    public BucketUrlSignerConfig setRegion(String region)
    {
        this.region = Optional.ofNullable(region);
        return this;
    }

    @NotNull
    public Duration getDefaultExpiry()
    {
        return defaultExpiry;
    }

    @Config("bucket-url-signer.default-expiry")
    @ConfigDescription("Validity of presigned URLs when the caller does not pass one")
    public BucketUrlSignerConfig setDefaultExpiry(Duration defaultExpiry)
    {
        this.defaultExpiry = requireNonNull(defaultExpiry, "defaultExpiry is null");
        return this;
    }

    @AssertTrue(message = "bucket-url-signer.default-expiry must be between 1s and 7d")
    public boolean isDefaultExpiryValid()
    {
        return defaultExpiry.compareTo(new Duration(1, TimeUnit.SECONDS)) >= 0 && defaultExpiry.compareTo(new Duration(7, TimeUnit.DAYS)) <= 0;
    }

    @Min(0)
    public int getParallelThreads()
    {
        return parallelThreads;
    }

    @Config("bucket-url-signer.parallel.threads")
    @ConfigDescription("Threads used to sign large batches, 0 signs every batch on the calling thread")
    public BucketUrlSignerConfig setParallelThreads(int parallelThreads)
    {
        this.parallelThreads = parallelThreads;
        return this;
    }

    @Min(1)
    public int getParallelMinBatchSize()
    {
        return parallelMinBatchSize;
    }

    @Config("bucket-url-signer.parallel.min-batch-size")
    @ConfigDescription("Smallest batch that is signed in parallel")
    public BucketUrlSignerConfig setParallelMinBatchSize(int parallelMinBatchSize)
    {
        this.parallelMinBatchSize = parallelMinBatchSize;
        return this;
    }
}
