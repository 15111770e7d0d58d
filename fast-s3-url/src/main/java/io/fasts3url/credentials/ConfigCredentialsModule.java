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
package io.fasts3url.credentials;

import com.google.inject.Binder;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.fasts3url.spi.credentials.Credential;
import io.fasts3url.spi.credentials.CredentialsProvider;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConditionalModule.conditionalModule;

public class ConfigCredentialsModule
        extends AbstractConfigurationAwareModule
{
    // set as config value for "credentials-provider.type"
    public static final String CONFIG_CREDENTIALS_PROVIDER = "config";

    @Override
    protected void setup(Binder binder)
    {
        install(conditionalModule(
                CredentialsProviderConfig.class,
                config -> config.getProviderType().map(CONFIG_CREDENTIALS_PROVIDER::equals).orElse(false),
                innerBinder -> {
                    ConfigCredentialsConfig config = buildConfigObject(ConfigCredentialsConfig.class);
                    Credential credential = Credential.of(config.getAccessKey(), config.getSecretKey(), config.getSessionToken());
                    newOptionalBinder(innerBinder, CredentialsProvider.class)
                            .setBinding()
                            .toInstance(CredentialsProvider.of(credential));
                }));
    }
}
