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
package net.graphiteql.storage.json;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import net.graphiteql.storage.BranchNode;
import net.graphiteql.storage.FindQuery;
import net.graphiteql.storage.Finder;
import net.graphiteql.storage.LeafNode;
import net.graphiteql.storage.Node;
import net.graphiteql.utils.GlobMatcher;

/**
 * Serves series stored as one JSON file per leaf under one or more root
 * directories. Path segments map to directories, the last one to a file
 * named {@code <segment>.json}. Entries starting with a dot are ignored.
 * @since 1.0
 */
public class JsonFinder implements Finder {
  private static final Logger LOG = LoggerFactory.getLogger(JsonFinder.class);

  /** Extension of series files */
  static final String EXTENSION = ".json";

  private final List<Path> directories;

  /**
   * Default ctor
   * @param directories The root directories, searched in order
   */
  public JsonFinder(final List<String> directories) {
    if (directories == null || directories.isEmpty()) {
      throw new IllegalArgumentException("At least one directory is required");
    }
    final ImmutableList.Builder<Path> roots = ImmutableList.builder();
    for (final String directory : directories) {
      roots.add(Paths.get(directory));
    }
    this.directories = roots.build();
  }

  @Override
  public Iterable<Node> findNodes(final FindQuery query) throws IOException {
    LOG.debug("Finding nodes for " + query);
    final List<String> pattern = GlobMatcher.splitPattern(query.getPattern());
    final List<Node> nodes = new ArrayList<Node>();
    for (final Path root : directories) {
      if (!Files.isDirectory(root)) {
        LOG.debug("Skipping missing directory " + root);
        continue;
      }
      find(root, pattern, 0, new ArrayList<String>(), nodes);
    }
    return nodes;
  }

  /**
   * Walks the tree one segment at a time.
   * @param current The directory matching the segments consumed so far
   * @param pattern All pattern segments
   * @param depth Index of the segment to match in current
   * @param prefix The matched names so far
   * @param nodes Where to put results
   */
  private void find(final Path current, final List<String> pattern,
      final int depth, final List<String> prefix, final List<Node> nodes)
      throws IOException {
    final List<String> subdirs = new ArrayList<String>();
    final List<String> leaves = new ArrayList<String>();
    final DirectoryStream<Path> entries = Files.newDirectoryStream(current);
    try {
      for (final Path entry : entries) {
        final String name = entry.getFileName().toString();
        if (name.startsWith(".")) {
          continue;
        }
        if (Files.isDirectory(entry)) {
          subdirs.add(name);
        } else if (name.endsWith(EXTENSION) && name.length() > EXTENSION.length()) {
          leaves.add(name.substring(0, name.length() - EXTENSION.length()));
        }
      }
    } finally {
      entries.close();
    }

    final String segment = pattern.get(depth);
    final List<String> matching_dirs = GlobMatcher.matchEntries(subdirs, segment);
    if (depth < pattern.size() - 1) {
      for (final String subdir : matching_dirs) {
        prefix.add(subdir);
        find(current.resolve(subdir), pattern, depth + 1, prefix, nodes);
        prefix.remove(prefix.size() - 1);
      }
      return;
    }

    for (final String leaf : GlobMatcher.matchEntries(leaves, segment)) {
      nodes.add(new LeafNode(path(prefix, leaf),
          new JsonReader(current.resolve(leaf + EXTENSION))));
    }
    for (final String subdir : matching_dirs) {
      nodes.add(new BranchNode(path(prefix, subdir)));
    }
  }

  private static String path(final List<String> prefix, final String name) {
    if (prefix.isEmpty()) {
      return name;
    }
    return Joiner.on('.').join(prefix) + "." + name;
  }

  /** @return the configured roots */
  public List<Path> getDirectories() {
    return directories;
  }

  @Override
  public String toString() {
    return "JsonFinder(" + directories + ")";
  }
}
