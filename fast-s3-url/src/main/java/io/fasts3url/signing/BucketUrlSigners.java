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

import io.fasts3url.spi.credentials.AsyncCredentialsProvider;
import io.fasts3url.spi.credentials.CredentialsProvider;
import io.fasts3url.spi.endpoint.BucketEndpoint;
import io.fasts3url.spi.endpoint.BucketEndpointProvider;

import java.util.concurrent.CompletableFuture;

public final class BucketUrlSigners
{
    private BucketUrlSigners() {}

    public static BucketUrlSigner create(BucketEndpointProvider endpointProvider, CredentialsProvider credentialsProvider)
    {
        BucketEndpoint endpoint = endpointProvider.bucketEndpoint();
        return new BucketUrlSigner(endpoint.bucketEndpointUrl(), credentialsProvider.credentials(), endpoint.region());
    }

    public static CompletableFuture<BucketUrlSigner> createAsync(BucketEndpointProvider endpointProvider, AsyncCredentialsProvider credentialsProvider)
    {
        BucketEndpoint endpoint = endpointProvider.bucketEndpoint();
        return credentialsProvider.credentials()
                .thenApply(credential -> new BucketUrlSigner(endpoint.bucketEndpointUrl(), credential, endpoint.region()));
    }
}
