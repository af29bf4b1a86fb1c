/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.pinverse.common;

import org.junit.Test;

public final class LangUtilsTest extends PinverseTest {

  private static final String PROPERTY = "pinverse.test.property";

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleNaN() {
    LangUtils.parseDouble("NaN");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleInf() {
    LangUtils.parseDouble("Infinity");
  }

  @Test(expected = NumberFormatException.class)
  public void testDoubleGarbage() {
    LangUtils.parseDouble("x1");
  }

  @Test
  public void testDouble() {
    assertEquals(3.1, LangUtils.parseDouble("3.1"));
    assertEquals(-1.0e-7, LangUtils.parseDouble("-1e-7"));
  }

  @Test
  public void testIsFinite() {
    assertTrue(LangUtils.isFinite(0.0));
    assertTrue(LangUtils.isFinite(-Double.MAX_VALUE));
    assertFalse(LangUtils.isFinite(Double.NaN));
    assertFalse(LangUtils.isFinite(Double.NEGATIVE_INFINITY));
  }

  @Test
  public void testProperties() {
    System.clearProperty(PROPERTY);
    assertEquals(2.5, LangUtils.getDoubleProperty(PROPERTY, 2.5));
    assertEquals(7, LangUtils.getIntProperty(PROPERTY, 7));
    assertTrue(LangUtils.getBooleanProperty(PROPERTY, true));
    System.setProperty(PROPERTY, " 12 ");
    try {
      assertEquals(12.0, LangUtils.getDoubleProperty(PROPERTY, 2.5));
      assertEquals(12, LangUtils.getIntProperty(PROPERTY, 7));
      assertFalse(LangUtils.getBooleanProperty(PROPERTY, true));
    } finally {
      System.clearProperty(PROPERTY);
    }
  }

}
