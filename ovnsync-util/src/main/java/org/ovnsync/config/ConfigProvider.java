/*
 * Copyright 2015 Midokura SARL
 *
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
package org.ovnsync.config;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Map;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.HierarchicalINIConfiguration;

import org.ovnsync.config.providers.HierarchicalConfigurationProvider;

/**
 * Builds configuration objects out of annotated interfaces. Sample usage:
 * <blockquote><pre>
 *   &#064;ConfigGroup("northbound")
 *   public interface NorthboundConfig {
 *
 *      &#064;ConfigInt(key = "request_timeout", defaultValue = 15000)
 *      int getRequestTimeout();
 *   }
 *
 *   ConfigProvider provider = ConfigProvider.fromIniFile("/etc/ovnsync.conf");
 *   NorthboundConfig config = provider.getConfig(NorthboundConfig.class);
 * </pre></blockquote>
 *
 * Every call on the returned proxy goes back to the provider, so changes in
 * the backing configuration are visible without rebuilding the proxy.
 */
@SuppressWarnings("JavaDoc")
public abstract class ConfigProvider {

    public abstract String getValue(String group, String key,
                                    String defaultValue);

    public abstract boolean getValue(String group, String key,
                                     boolean defaultValue);

    public abstract int getValue(String group, String key, int defaultValue);

    public abstract long getValue(String group, String key, long defaultValue);

    /**
     * All the values explicitly set in the backend, keyed by
     * "group.key".
     */
    public abstract Map<String, Object> getAll();

    public <Config> Config getConfig(Class<Config> configInterface) {
        return getConfig(configInterface, this);
    }

    public static ConfigProvider providerForIniConfig(
            HierarchicalConfiguration config) {
        return new HierarchicalConfigurationProvider(config);
    }

    public static ConfigProvider fromIniFile(String path)
            throws ConfigurationException {
        HierarchicalINIConfiguration config = new HierarchicalINIConfiguration();
        config.setDelimiterParsingDisabled(true);
        config.setFileName(path);
        config.load();
        return providerForIniConfig(config);
    }

    @SuppressWarnings("unchecked")
    public static <Config> Config getConfig(Class<Config> configInterface,
                                            final ConfigProvider provider) {
        InvocationHandler handler = new InvocationHandler() {
            @Override
            public Object invoke(Object proxy, Method method, Object[] args)
                throws Throwable {
                if (method.getDeclaringClass() == Object.class) {
                    return method.invoke(provider, args);
                }
                return handleInvocation(method, provider);
            }
        };

        return (Config) Proxy.newProxyInstance(
            configInterface.getClassLoader(), new Class[]{configInterface},
            handler);
    }

    private static Object handleInvocation(Method method,
                                           ConfigProvider provider) {

        ConfigInt intEntry = method.getAnnotation(ConfigInt.class);
        if (intEntry != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     intEntry.key(), intEntry.defaultValue());
        }

        ConfigLong longEntry = method.getAnnotation(ConfigLong.class);
        if (longEntry != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     longEntry.key(), longEntry.defaultValue());
        }

        ConfigBool boolEntry = method.getAnnotation(ConfigBool.class);
        if (boolEntry != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     boolEntry.key(), boolEntry.defaultValue());
        }

        ConfigString strEntry = method.getAnnotation(ConfigString.class);
        if (strEntry != null) {
            return provider.getValue(findDeclaredGroupName(method),
                                     strEntry.key(), strEntry.defaultValue());
        }

        throw new IllegalArgumentException(
            "Method " + method.toGenericString() + " is used as a config " +
            "accessor but has none of the @ConfigInt, @ConfigLong, " +
            "@ConfigString, @ConfigBool annotations.");
    }

    private static String findDeclaredGroupName(Method method) {
        ConfigGroup group = method.getAnnotation(ConfigGroup.class);
        if (group == null) {
            group = method.getDeclaringClass().getAnnotation(ConfigGroup.class);
        }
        if (group != null) {
            return group.value();
        }

        throw new IllegalArgumentException(
            "Method " + method.toGenericString() + " is used as a config " +
            "accessor but neither it nor its declaring interface carries a " +
            "@ConfigGroup annotation");
    }
}
