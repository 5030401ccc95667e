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
package net.hydromatic.leftrec;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.leftrec.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests for various utility classes. */
public class UtilTest {
  /** Tests {@link Prop}. */
  @Test
  void testProp() {
    assertThat(Prop.lookup("trace"), sameInstance(Prop.TRACE));
    assertThat(Prop.lookup("TRACE"), sameInstance(Prop.TRACE));
    assertThat(
        Prop.lookup("definitionSeparator"),
        sameInstance(Prop.DEFINITION_SEPARATOR));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("trac"));
    assertThat(
        Prop.lookup("ALTERNATIVE_SEPARATOR"),
        sameInstance(Prop.ALTERNATIVE_SEPARATOR));

    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.TRACE.booleanValue(map), is(false));
    assertThat(Prop.DEFINITION_SEPARATOR.stringValue(map), is(":= "));
    assertThat(Prop.ALTERNATIVE_SEPARATOR.stringValue(map), is(" or "));

    Prop.TRACE.set(map, true);
    assertThat(Prop.TRACE.booleanValue(map), is(true));
    Prop.TRACE.setLenient(map, "false");
    assertThat(Prop.TRACE.booleanValue(map), is(false));
    Prop.DEFINITION_SEPARATOR.setLenient(map, " = ");
    assertThat(Prop.DEFINITION_SEPARATOR.stringValue(map), is(" = "));

    // Wrong type, either when setting or when getting
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TRACE.set(map, "true"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TRACE.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.TRACE.stringValue(map));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.DEFINITION_SEPARATOR.booleanValue(map));

    // All properties are required
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.TRACE.set(map, null));
    assertThat(e.getMessage(), is("property trace is required"));
    assertThat(Prop.TRACE.booleanValue(map), is(false));
  }
}

// End UtilTest.java
