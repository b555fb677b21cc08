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
package net.graphiteql.storage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

public class TestMultiReader {
  private Reader fine;
  private Reader coarse;
  private Reader broken;

  @Before
  public void before() throws Exception {
    fine = mock(Reader.class);
    coarse = mock(Reader.class);
    broken = mock(Reader.class);
    when(fine.fetch(anyLong(), anyLong(), any(),
        any())).thenReturn(new FetchResult(
            new TimeInfo(0, 40, 10), Arrays.asList(1.0, null, 3.0, null)));
    when(coarse.fetch(anyLong(), anyLong(), any(),
        any())).thenReturn(new FetchResult(
            new TimeInfo(0, 40, 20), Arrays.asList(10.0, 20.0)));
    when(broken.fetch(anyLong(), anyLong(), any(),
        any())).thenThrow(new IOException("Boo!"));
  }

  private static List<LeafNode> leaves(final Reader... readers) {
    final ImmutableList.Builder<LeafNode> leaves = ImmutableList.builder();
    for (final Reader reader : readers) {
      leaves.add(new LeafNode("a.b", reader));
    }
    return leaves.build();
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNull() throws Exception {
    new MultiReader(null);
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorEmpty() throws Exception {
    new MultiReader(ImmutableList.<LeafNode>of());
  }

  @Test
  public void mergeFillsGapsFromCoarse() throws Exception {
    final FetchResult merged = MultiReader.merge(
        new FetchResult(new TimeInfo(0, 40, 10),
            Arrays.asList(1.0, null, 3.0, null)),
        new FetchResult(new TimeInfo(0, 40, 20), Arrays.asList(10.0, 20.0)));
    assertEquals(new TimeInfo(0, 40, 10), merged.getTimeInfo());
    assertEquals(Arrays.asList(1.0, 10.0, 3.0, 20.0), merged.getValues());
  }

  @Test
  public void mergeOrderDoesNotMatter() throws Exception {
    final FetchResult merged = MultiReader.merge(
        new FetchResult(new TimeInfo(0, 40, 20), Arrays.asList(10.0, 20.0)),
        new FetchResult(new TimeInfo(0, 40, 10),
            Arrays.asList(1.0, null, 3.0, null)));
    assertEquals(Arrays.asList(1.0, 10.0, 3.0, 20.0), merged.getValues());
  }

  @Test
  public void mergeUnionOfWindows() throws Exception {
    final FetchResult merged = MultiReader.merge(
        new FetchResult(new TimeInfo(20, 40, 10), Arrays.asList(5.0, 6.0)),
        new FetchResult(new TimeInfo(0, 40, 20), Arrays.asList(1.0, 2.0)));
    assertEquals(new TimeInfo(0, 40, 10), merged.getTimeInfo());
    assertEquals(Arrays.asList(1.0, 1.0, 5.0, 6.0), merged.getValues());
  }

  @Test
  public void mergeShortValues() throws Exception {
    final FetchResult merged = MultiReader.merge(
        new FetchResult(new TimeInfo(0, 40, 10), Arrays.asList(1.0)),
        new FetchResult(new TimeInfo(0, 40, 10), Arrays.asList(null, 2.0)));
    assertEquals(Arrays.asList(1.0, 2.0, null, null), merged.getValues());
  }

  @Test
  public void fetchMerges() throws Exception {
    final MultiReader reader = new MultiReader(leaves(coarse, fine));
    final FetchResult result = reader.fetch(0, 40, null, null);
    assertEquals(Arrays.asList(1.0, 10.0, 3.0, 20.0), result.getValues());
  }

  @Test
  public void fetchSkipsFailures() throws Exception {
    final MultiReader reader = new MultiReader(leaves(broken, fine));
    final FetchResult result = reader.fetch(0, 40, null, null);
    assertEquals(Arrays.asList(1.0, null, 3.0, null), result.getValues());
  }

  @Test
  public void fetchAllFailed() throws Exception {
    final MultiReader reader = new MultiReader(leaves(broken, broken));
    try {
      reader.fetch(0, 40, null, null);
      fail("Expected AllSourcesFailedException");
    } catch (AllSourcesFailedException e) {
      assertTrue(e.getMessage().contains("a.b"));
    }
  }

  @Test (expected = AllSourcesFailedException.class)
  public void fetchNoData() throws Exception {
    final Reader empty = mock(Reader.class);
    new MultiReader(leaves(empty)).fetch(0, 40, null, null);
  }

  @Test
  public void intervals() throws Exception {
    final RangeSet<Long> first = TreeRangeSet.create();
    first.add(Range.closed(0L, 10L));
    final RangeSet<Long> second = TreeRangeSet.create();
    second.add(Range.closed(5L, 20L));
    second.add(Range.closed(30L, 40L));
    when(fine.intervals()).thenReturn(first);
    when(coarse.intervals()).thenReturn(second);

    final RangeSet<Long> union = new MultiReader(leaves(fine, coarse))
        .intervals();
    assertEquals(2, union.asRanges().size());
    assertTrue(union.encloses(Range.closed(0L, 20L)));
    assertTrue(union.contains(35L));
  }
}
