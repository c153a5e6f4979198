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
package org.funnelscope.plugin;

import com.google.inject.Binder;
import io.airlift.configuration.ConfigurationAwareModule;
import io.airlift.configuration.ConfigurationFactory;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

public abstract class FunnelModule
        implements ConfigurationAwareModule {
    private ConfigurationFactory configurationFactory;
    private Binder binder;

    @Override
    public synchronized void setConfigurationFactory(ConfigurationFactory configurationFactory) {
        this.configurationFactory = checkNotNull(configurationFactory, "configurationFactory is null");
    }

    @Override
    public final synchronized void configure(Binder binder) {
        checkState(this.binder == null, "re-entry not allowed");
        checkState(configurationFactory != null, "configurationFactory is not set");
        this.binder = checkNotNull(binder, "binder is null");

        try {
            ConditionalModule annotation = this.getClass().getAnnotation(ConditionalModule.class);
            if (annotation != null) {
                String value = Optional.ofNullable(configurationFactory.getProperties().get(annotation.config()))
                        .map(String::trim).orElse(null);
                if (!Objects.equals(annotation.value(), value)) {
                    return;
                }
            }

            setup(binder);
        } finally {
            this.binder = null;
        }
    }

    /**
     * Builds the configuration bean from the properties and binds it as a singleton instance.
     */
    protected synchronized <T> T buildConfigObject(Class<T> configClass) {
        T config = configurationFactory.build(configClass);
        binder.bind(configClass).toInstance(config);
        return config;
    }

    protected synchronized String getConfig(String config) {
        return configurationFactory.getProperties().get(config);
    }

    protected synchronized void install(FunnelModule module) {
        module.setConfigurationFactory(configurationFactory);
        binder.install(module);
    }

    protected abstract void setup(Binder binder);

    public abstract String name();

    public abstract String description();
}
