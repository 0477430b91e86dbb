// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Typed model of Japanese statute XML documents.
 * <p>
 * {@link jalaw.law.LawParser} binds a whole document into a {@link jalaw.law.Law}; every other node kind has a public
 * constructor taking the {@link jalaw.xml.XmlElement} it is bound to, so fragments can be bound on their own.
 * <p>
 * Attributes and structural children are bound when a node is constructed, so a missing required field or a bad
 * attribute value fails the whole binding. Mixed content and the flattened text derived from it are resolved on first
 * access and cached.
 */
@NonNullByDefault
package jalaw.law;

import jalaw.util.annotation.NonNullByDefault;
