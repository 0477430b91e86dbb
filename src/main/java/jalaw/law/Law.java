// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import java.time.DateTimeException;
import java.time.MonthDay;
import java.util.stream.Stream;
import jalaw.util.Trace;
import jalaw.util.annotation.Nullable;
import jalaw.util.condition.ConditionContext;
import jalaw.xml.XmlElement;

/**
 * A whole law document: its identity and its body.
 */
public final class Law implements TextSource {
    public Law(final XmlElement element) {
        Elements.expectTag(element, "Law");
        try (final var trace = new Trace(() -> describe(element))) {
            trace.use();
            era = Attributes.requiredString(element, "Era");
            year = Attributes.requiredInteger(element, "Year", 1);
            num = Attributes.requiredInteger(element, "Num", 0);
            lawType = Attributes.requiredEnumeration(element, "LawType", LawType::byXmlName);
            lang = Attributes.requiredEnumeration(element, "Lang", Language::byXmlName);
            promulgateMonth = Attributes.integer(element, "PromulgateMonth", 1);
            promulgateDay = Attributes.integer(element, "PromulgateDay", 1);
            promulgation = parsePromulgation(element, promulgateMonth, promulgateDay);
            lawNum = Elements.requiredLeafText(element, "LawNum");
            lawBody = Elements.required(element, "LawBody", LawBody::new);
        }
    }

    /**
     * Retrieves the era name, like {@code "Reiwa"}.
     */
    public String era() {
        return era;
    }

    /**
     * Retrieves the year within the era.
     */
    public int year() {
        return year;
    }

    /**
     * Retrieves the sequence number of the law within its year and type.
     */
    public int num() {
        return num;
    }

    public LawType lawType() {
        return lawType;
    }

    public Language lang() {
        return lang;
    }

    public @Nullable Integer promulgateMonth() {
        return promulgateMonth;
    }

    public @Nullable Integer promulgateDay() {
        return promulgateDay;
    }

    /**
     * Retrieves the promulgation month and day together, or {@code null} if the document doesn't give them.
     */
    public @Nullable MonthDay promulgation() {
        return promulgation;
    }

    /**
     * Retrieves the law number as printed, like {@code 令和元年法律第一号}.
     */
    public String lawNum() {
        return lawNum;
    }

    public LawBody lawBody() {
        return lawBody;
    }

    @Override
    public Stream<String> texts() {
        return lawBody.texts();
    }

    private static @Nullable MonthDay parsePromulgation(
        final XmlElement element,
        final @Nullable Integer month,
        final @Nullable Integer day
    ) {
        if (month == null && day == null) {
            return null;
        }
        if (month == null || day == null) {
            final var missing = (month == null) ? "PromulgateMonth" : "PromulgateDay";
            throw ConditionContext.error(new MissingFieldErrorCondition(
                missing,
                "PromulgateMonth and PromulgateDay must be given together, but " + missing + " is missing from "
                    + element
            ));
        }
        try {
            return MonthDay.of(month, day);
        } catch (final DateTimeException e) {
            final var badMonth = month > 12;
            throw ConditionContext.error(new InvalidAttributeErrorCondition(
                badMonth ? "PromulgateMonth" : "PromulgateDay",
                String.valueOf(badMonth ? month : day),
                "Invalid promulgation date " + month + "-" + day + " in " + element + ": " + e.getMessage()
            ));
        }
    }

    private static String describe(final XmlElement element) {
        final var lawNum = element.child("LawNum");
        final var text = (lawNum != null) ? lawNum.text() : null;
        return (text != null) ? "Binding law " + text : "Binding law " + element;
    }

    private final String era;
    private final int year;
    private final int num;
    private final LawType lawType;
    private final Language lang;
    private final @Nullable Integer promulgateMonth;
    private final @Nullable Integer promulgateDay;
    private final @Nullable MonthDay promulgation;
    private final String lawNum;
    private final LawBody lawBody;
}
