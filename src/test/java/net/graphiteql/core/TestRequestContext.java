// This file is part of GraphiteQL.
// Copyright (C) 2026  The GraphiteQL Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.graphiteql.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.TimeZone;

import org.junit.Test;

public class TestRequestContext {

  @Test
  public void ctorDefaults() throws Exception {
    final RequestContext context =
        new RequestContext(null, 10, 20, null, null, null);
    assertEquals(10, context.getStartTime());
    assertEquals(20, context.getEndTime());
    assertNull(context.getNow());
    assertEquals("UTC", context.getTimeZone().getID());
    assertTrue(context.getTemplate().isEmpty());
    assertTrue(context.getScratch().isEmpty());
    assertTrue(context.getData().isEmpty());
  }

  @Test
  public void ctorCopiesTemplate() throws Exception {
    final Map<String, Object> template = new HashMap<String, Object>();
    template.put("host", "web01");
    final RequestContext context = new RequestContext(null, 10, 20, 30L,
        TimeZone.getTimeZone("America/Denver"), template);
    template.put("other", "x");
    assertEquals(1, context.getTemplate().size());
    assertEquals(30L, (long) context.getNow());
    assertEquals("America/Denver", context.getTimeZone().getID());
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorInverted() throws Exception {
    new RequestContext(null, 20, 10, null, null, null);
  }

  @Test
  public void emptyWindowAllowed() throws Exception {
    assertEquals(10, new RequestContext(null, 10, 10, null, null, null)
        .getEndTime());
  }

  @Test
  public void copySharesState() throws Exception {
    final RequestContext context =
        new RequestContext(null, 100, 200, 300L, null, null);
    context.getScratch().put("key", "value");
    final RequestContext copy = context.copy(50, 150);
    assertEquals(50, copy.getStartTime());
    assertEquals(150, copy.getEndTime());
    assertEquals(300L, (long) copy.getNow());
    assertSame(context.getScratch(), copy.getScratch());
    assertSame(context.getTemplate(), copy.getTemplate());
    assertSame(context.getData(), copy.getData());
    assertEquals(100, context.getStartTime());
  }

  @Test (expected = IllegalArgumentException.class)
  public void copyInverted() throws Exception {
    new RequestContext(null, 100, 200, null, null, null).copy(150, 50);
  }
}
