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

import io.fasts3url.spi.credentials.AsyncCredentialsProvider;
import io.fasts3url.spi.credentials.Credential;
import io.fasts3url.spi.credentials.CredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.identity.spi.AwsCredentialsIdentity;
import software.amazon.awssdk.identity.spi.AwsSessionCredentialsIdentity;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * Freezes the current credentials of an AWS SDK {@link AwsCredentialsProvider}. Resolving may
 * make the SDK provider refresh; the returned {@link Credential} never changes afterwards.
 */
public class AwsSdkCredentialsProvider
        implements CredentialsProvider
{
    private final AwsCredentialsProvider delegate;

    public AwsSdkCredentialsProvider(AwsCredentialsProvider delegate)
    {
        this.delegate = requireNonNull(delegate, "delegate is null");
    }

    @Override
    public Credential credentials()
    {
        return toCredential(delegate.resolveCredentials());
    }

    public CompletableFuture<Credential> credentialsAsync()
    {
        return delegate.resolveIdentity().thenApply(AwsSdkCredentialsProvider::toCredential);
    }

    public AsyncCredentialsProvider asAsync()
    {
        return this::credentialsAsync;
    }

    public static Credential toCredential(AwsCredentialsIdentity identity)
    {
        requireNonNull(identity, "identity is null");
        Optional<String> session = Optional.empty();
        if (identity instanceof AwsSessionCredentialsIdentity sessionIdentity) {
            session = Optional.ofNullable(sessionIdentity.sessionToken()).filter(token -> !token.isEmpty());
        }
        return Credential.of(identity.accessKeyId(), identity.secretAccessKey(), session);
    }
}
