/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.leftrec.util;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value. Every property has a default.
 */
public enum Prop {
  /**
   * String property "alternativeSeparator" is written between the productions
   * of a rule when a grammar is printed. Default is " or ".
   */
  ALTERNATIVE_SEPARATOR("alternativeSeparator", String.class, " or "),

  /**
   * String property "definitionSeparator" is written between the left-hand
   * side of a rule and its first production when a grammar is printed.
   * Default is ":= ".
   */
  DEFINITION_SEPARATOR("definitionSeparator", String.class, ":= "),

  /**
   * Boolean property "trace" controls whether the steps of left-recursion
   * analysis are printed. Default is false.
   */
  TRACE("trace", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Properties keyed by both {@link #name()} and {@link #camelName}. */
  private static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : values()) {
      b.put(prop.name(), prop);
      b.put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = requireNonNull(defaultValue);
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /**
   * Looks up a property by its camel-case name (such as "trace") or its
   * enum name (such as "TRACE"). Never returns null.
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    return value(map, Boolean.class);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    return value(map, String.class);
  }

  private <T> T value(Map<Prop, Object> map, Class<T> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        requestedType.getSimpleName(),
        camelName);
    final Object o = map.get(this);
    return requestedType.cast(o != null ? o : defaultValue);
  }

  /**
   * Sets the value of a property from its text, as given on the command line.
   * A boolean property accepts "true" or "false".
   */
  public void setLenient(Map<Prop, Object> map, String value) {
    if (type == Boolean.class) {
      checkArgument(
          value.equals("true") || value.equals("false"),
          "value for property %s must be true or false",
          camelName);
      set(map, Boolean.valueOf(value));
    } else {
      set(map, value);
    }
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    checkArgument(value != null, "property %s is required", camelName);
    checkArgument(
        type.isInstance(value),
        "value for property %s must have type %s",
        camelName,
        type.getSimpleName());
    map.put(this, value);
  }
}

// End Prop.java
