// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The minimal DOM: tree nodes, and the builder that assembles them from HTML events.
 */
@DefaultQualifier(NonNull.class)
package dim.dom;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.framework.qual.DefaultQualifier;
