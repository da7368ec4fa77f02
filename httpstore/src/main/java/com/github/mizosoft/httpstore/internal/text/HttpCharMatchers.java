/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.httpstore.internal.text;

import static com.github.mizosoft.httpstore.internal.text.CharMatcher.anyOf;
import static com.github.mizosoft.httpstore.internal.text.CharMatcher.lettersOrDigits;
import static com.github.mizosoft.httpstore.internal.text.CharMatcher.withinClosedRange;

/** Common {@code CharMatchers} for HTTP headers and cache keys. */
public class HttpCharMatchers {
  private HttpCharMatchers() {} // non-instantiable

  // token          = 1*tchar
  // tchar          = "!" / "#" / "$" / "%" / "&" / "'" / "*"
  //                    / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~"
  //                    / DIGIT / ALPHA
  //                    ; any VCHAR, except delimiters
  public static final CharMatcher TOKEN_MATCHER = anyOf("!#$%&'*+-.^_`|~").or(lettersOrDigits());

  // field-content  = field-vchar [ 1*( SP / HTAB ) field-vchar ]
  // field-vchar    = VCHAR / obs-text
  public static final CharMatcher FIELD_VALUE_MATCHER =
      withinClosedRange(0x21, 0x7E) // VCHAR
          .or(anyOf(" \t")) // ( SP / HTAB )
          .or(withinClosedRange(0x80, 0xFF)); // obs-text

  // quoted-string  = DQUOTE *( qdtext / quoted-pair ) DQUOTE
  // qdtext         = HTAB / SP / %x21 / %x23-5B / %x5D-7E / obs-text
  public static final CharMatcher QUOTED_TEXT_MATCHER =
      anyOf("\t !") // HTAB + SP + 0x21
          .or(withinClosedRange(0x23, 0x5B))
          .or(withinClosedRange(0x5D, 0x7E));

  // quoted-pair    = "\" ( HTAB / SP / VCHAR / obs-text )
  public static final CharMatcher QUOTED_PAIR_MATCHER =
      anyOf("\t ") // HTAB + SP
          .or(withinClosedRange(0x21, 0x7E)); // VCHAR

  //  OWS = *( SP / HTAB )
  public static final CharMatcher OWS_MATCHER = anyOf("\t ");

  /** Characters that can't appear in a cache tag, as they're used by backends as separators. */
  public static final CharMatcher RESERVED_TAG_MATCHER = anyOf("{}()/\\@:");
}
