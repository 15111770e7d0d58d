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
package io.fasts3url.awssdk;

import io.fasts3url.signing.BucketUrlSigner;
import io.fasts3url.signing.BucketUrlSigners;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.util.concurrent.CompletableFuture;

/**
 * Builds a {@link BucketUrlSigner} from the same objects an application already uses to presign
 * with the AWS SDK. The presigner is only used once to discover the bucket endpoint.
 */
public final class AwsSdkBucketUrlSigners
{
    private AwsSdkBucketUrlSigners() {}

    public static BucketUrlSigner fromPresigner(S3Presigner presigner, String bucket, Region region, AwsCredentialsProvider credentialsProvider)
    {
        return BucketUrlSigners.create(
                new S3PresignerBucketEndpointProvider(presigner, bucket, region),
                new AwsSdkCredentialsProvider(credentialsProvider));
    }

    public static CompletableFuture<BucketUrlSigner> fromPresignerAsync(S3Presigner presigner, String bucket, Region region, AwsCredentialsProvider credentialsProvider)
    {
        return BucketUrlSigners.createAsync(
                new S3PresignerBucketEndpointProvider(presigner, bucket, region),
                new AwsSdkCredentialsProvider(credentialsProvider).asAsync());
    }
}
