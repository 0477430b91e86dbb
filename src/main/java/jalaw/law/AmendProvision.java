// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.util.List;
import java.util.stream.Stream;
import jalaw.util.annotation.Nullable;
import jalaw.xml.XmlElement;

/**
 * An amendment instruction and the provisions it inserts.
 * <p>
 * The instruction is kept as text; nothing is applied to the law being amended.
 */
public final class AmendProvision implements TextSource {
    public AmendProvision(final XmlElement element) {
        Elements.expectTag(element, "AmendProvision");
        sentence = Elements.optional(element, "AmendProvisionSentence", ProvisionSentence::new);
        newProvisions = Elements.list(element, "NewProvision", NewProvision::new);
    }

    public @Nullable ProvisionSentence sentence() {
        return sentence;
    }

    public List<NewProvision> newProvisions() {
        return newProvisions;
    }

    @Override
    public Stream<String> texts() {
        return Texts.concat(Texts.of(sentence), Texts.of(newProvisions));
    }

    private final @Nullable ProvisionSentence sentence;
    private final List<NewProvision> newProvisions;
}
