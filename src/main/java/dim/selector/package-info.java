// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * CSS selectors: the parser, the immutable selector model, and the matching engine.
 */
@DefaultQualifier(NonNull.class)
package dim.selector;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.framework.qual.DefaultQualifier;
