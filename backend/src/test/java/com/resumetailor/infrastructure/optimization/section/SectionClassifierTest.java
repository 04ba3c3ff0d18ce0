package com.resumetailor.infrastructure.optimization.section;

import com.resumetailor.domain.optimization.model.SectionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectionClassifierTest {

    private SectionClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new SectionClassifier();
    }

    @Nested
    @DisplayName("Header detection")
    class Headers {

        @Test
        @DisplayName("Plain headers in any case")
        void plain_headers() {
            assertThat(classifier.headerSection("SKILLS")).contains(SectionType.SKILLS);
            assertThat(classifier.headerSection("Summary")).contains(SectionType.SUMMARY);
            assertThat(classifier.headerSection("education")).contains(SectionType.EDUCATION);
            assertThat(classifier.headerSection("Projects")).contains(SectionType.PROJECTS);
            assertThat(classifier.headerSection("Certifications")).contains(SectionType.CERTIFICATIONS);
        }

        @Test
        @DisplayName("Multi-word headers and trailing punctuation")
        void multi_word_headers() {
            assertThat(classifier.headerSection("Technical Skills:")).contains(SectionType.SKILLS);
            assertThat(classifier.headerSection("Professional Experience")).contains(SectionType.EXPERIENCE);
            assertThat(classifier.headerSection("Work History -")).contains(SectionType.EXPERIENCE);
            assertThat(classifier.headerSection("Awards & Honors")).contains(SectionType.AWARDS);
        }

        @Test
        @DisplayName("Longest matching keyword wins")
        void longest_keyword_wins() {
            assertThat(classifier.headerSection("Volunteer Experience")).contains(SectionType.OTHER);
            assertThat(classifier.headerSection("Languages")).contains(SectionType.OTHER);
        }

        @Test
        @DisplayName("Inline label with content is not a header")
        void inline_label_is_not_header() {
            assertThat(classifier.isHeader("Skills: Java, Python")).isFalse();
        }

        @Test
        @DisplayName("More than five words is not a header")
        void long_line_is_not_header() {
            assertThat(classifier.isHeader("Experience building distributed systems at scale for fintech clients"))
                    .isFalse();
        }

        @Test
        @DisplayName("Keyword must end at a word boundary")
        void word_boundary() {
            assertThat(classifier.isHeader("Skillset")).isFalse();
        }

        @Test
        @DisplayName("Blank and null are not headers")
        void blank_is_not_header() {
            assertThat(classifier.isHeader("")).isFalse();
            assertThat(classifier.isHeader("   ")).isFalse();
            assertThat(classifier.isHeader(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Content classification")
    class Content {

        @Test
        @DisplayName("Header keyword inside the text")
        void header_keyword_in_text() {
            assertThat(classifier.classify("Skills: Java, Python")).isEqualTo(SectionType.SKILLS);
            assertThat(classifier.classify("Five years of experience with Java")).isEqualTo(SectionType.EXPERIENCE);
        }

        @Test
        @DisplayName("Verb and degree hints")
        void content_hints() {
            assertThat(classifier.classify("Developed a chat app with WebSockets")).isEqualTo(SectionType.PROJECTS);
            assertThat(classifier.classify("Led a team of five engineers")).isEqualTo(SectionType.EXPERIENCE);
            assertThat(classifier.classify("Bachelor of Science in Computer Science")).isEqualTo(SectionType.EDUCATION);
        }

        @Test
        @DisplayName("Nothing recognizable -> OTHER")
        void fallback_other() {
            assertThat(classifier.classify("Jane Doe")).isEqualTo(SectionType.OTHER);
            assertThat(classifier.classify("Enjoys hiking and chess")).isEqualTo(SectionType.OTHER);
            assertThat(classifier.classify("")).isEqualTo(SectionType.OTHER);
            assertThat(classifier.classify(null)).isEqualTo(SectionType.OTHER);
        }
    }
}
