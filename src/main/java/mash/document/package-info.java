// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Lexical layer of mash documents: turning raw text into addressed elements.
 * <p>
 * A document is UTF-8 text with three structural markers, {@code [[[} (open frame), {@code |||} (separator) and
 * {@code ]]]} (close frame). The {@link mash.document.Scanner} finds markers and line breaks, the
 * {@link mash.document.Addresser} attaches source locations, and the {@link mash.document.Compressor} merges
 * literal runs; {@link mash.document.Documents#elements(String, String, int)} chains the three.
 */
@NonNullByDefault
package mash.document;

import mash.util.annotation.NonNullByDefault;
