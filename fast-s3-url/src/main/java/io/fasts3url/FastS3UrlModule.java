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
package io.fasts3url;

import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.fasts3url.credentials.ConfigCredentialsModule;
import io.fasts3url.credentials.CredentialsProviderConfig;
import io.fasts3url.signing.BucketLocation;
import io.fasts3url.signing.BucketUrlSigner;
import io.fasts3url.signing.BucketUrlSignerConfig;
import io.fasts3url.signing.SigningExecutor;
import io.fasts3url.spi.credentials.Credential;
import io.fasts3url.spi.credentials.CredentialsProvider;

import java.time.Clock;
import java.util.Optional;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConfigBinder.configBinder;

/**
 * Binds a singleton {@link BucketUrlSigner} built from {@link BucketUrlSignerConfig}.
 * Credentials come from a {@link CredentialsProvider} binding, either set by the application
 * through {@code OptionalBinder} or installed from configuration with
 * {@code credentials-provider.type=config}.
 */
public class FastS3UrlModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(BucketUrlSignerConfig.class);
        configBinder(binder).bindConfig(CredentialsProviderConfig.class);

        newOptionalBinder(binder, CredentialsProvider.class);
        install(new ConfigCredentialsModule());

        binder.bind(SigningExecutor.class).in(Scopes.SINGLETON);
        newOptionalBinder(binder, Clock.class).setDefault().toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    public BucketUrlSigner createBucketUrlSigner(BucketUrlSignerConfig config, Optional<CredentialsProvider> credentialsProvider, Clock clock, SigningExecutor signingExecutor)
    {
        Credential credential = credentialsProvider
                .orElseThrow(() -> new IllegalStateException("No %s is bound, bind one or set credentials-provider.type".formatted(CredentialsProvider.class.getSimpleName())))
                .credentials();

        return new BucketUrlSigner(
                BucketLocation.parse(config.getEndpoint()),
                credential,
                config.getRegion(),
                clock,
                config.getDefaultExpiry().toJavaTime(),
                signingExecutor.parallelSigning());
    }
}
