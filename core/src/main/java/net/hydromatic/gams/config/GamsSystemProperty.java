/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.gams.config;

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

/**
 * A system property that configures the GAMS algebra library.
 *
 * <p>Properties must be in the "gams" root namespace. Values come from
 * the file {@code gams.properties}, if it is on the class path, overridden
 * by Java system properties. Each value is read once, when this class is
 * initialized.</p>
 *
 * @param <T> the type of the property value
 */
public final class GamsSystemProperty<T> {
  /** Holds all system properties in the "gams" namespace. */
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run in debug mode.
   *
   * <p>In debug mode every {@link net.hydromatic.gams.runtime.GamsException}
   * is logged at ERROR level when it is created.</p>
   */
  public static final GamsSystemProperty<Boolean> DEBUG =
      booleanProperty("gams.debug", false);

  /**
   * Length after which the renderer breaks a line after a binary operator.
   *
   * <p>GAMS rejects input lines longer than 80000 characters; folding long
   * before that limit keeps generated listings readable. Values below 80
   * are ignored.</p>
   */
  public static final GamsSystemProperty<Integer> FOLD_LENGTH =
      intProperty("gams.render.foldLength", 1000, v -> v >= 80);

  private static GamsSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new GamsSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as {@code
   * int}. If any of the conditions below hold, returns the
   * <code>defaultValue</code>:
   *
   * <ol>
   * <li>the property is not defined;
   * <li>the property value cannot be transformed to an int;
   * <li>the property value does not satisfy the checker.
   * </ol>
   */
  private static GamsSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new GamsSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static Properties loadProperties() {
    final Properties fileProperties = new Properties();
    final ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        GamsSystemProperty.class.getClassLoader());
    try (InputStream stream = classLoader.getResourceAsStream("gams.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from gams.properties file", e);
    }

    // System properties take precedence over the file
    final Properties allProperties = new Properties();
    Stream.concat(
        fileProperties.entrySet().stream(),
        System.getProperties().entrySet().stream())
        .forEach(prop -> {
          final String key = String.valueOf(prop.getKey());
          if (key.startsWith("gams.")) {
            allProperties.setProperty(key, String.valueOf(prop.getValue()));
          }
        });
    return allProperties;
  }

  private final String key;
  private final T value;

  private GamsSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property, for example "gams.debug". */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default if it is not set
   */
  public T value() {
    return value;
  }
}
