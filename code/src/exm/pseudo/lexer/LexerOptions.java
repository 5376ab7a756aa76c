/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.pseudo.lexer;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable lexer configuration: the keyword table and the markers that
 * start a comment running to the end of the line.
 */
public class LexerOptions {

  public static final ImmutableList<String> DEFAULT_COMMENT_MARKERS =
                                              ImmutableList.of("#", "//");

  private static final LexerOptions DEFAULTS =
      new LexerOptions(KeywordTable.standard(), DEFAULT_COMMENT_MARKERS);

  private final KeywordTable keywords;
  private final ImmutableList<String> commentMarkers;

  public LexerOptions(KeywordTable keywords, List<String> commentMarkers) {
    Preconditions.checkNotNull(keywords);
    Preconditions.checkArgument(!commentMarkers.isEmpty(),
                                "need at least one comment marker");
    for (String marker: commentMarkers) {
      Preconditions.checkArgument(!marker.isEmpty(),
                                  "empty comment marker");
    }
    this.keywords = keywords;
    this.commentMarkers = ImmutableList.copyOf(commentMarkers);
  }

  public static LexerOptions defaults() {
    return DEFAULTS;
  }

  public KeywordTable keywords() {
    return keywords;
  }

  public ImmutableList<String> commentMarkers() {
    return commentMarkers;
  }
}
