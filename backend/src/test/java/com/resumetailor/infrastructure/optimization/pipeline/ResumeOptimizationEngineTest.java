package com.resumetailor.infrastructure.optimization.pipeline;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.domain.optimization.model.OptimizationResult;
import com.resumetailor.domain.optimization.model.ResumeDocument;
import com.resumetailor.domain.optimization.service.DocumentStore;
import com.resumetailor.infrastructure.optimization.OptimizerSettings;
import com.resumetailor.infrastructure.optimization.ResumeInputException;
import com.resumetailor.infrastructure.optimization.enhancement.ContextualEnhancer;
import com.resumetailor.infrastructure.optimization.enhancement.DensityGuard;
import com.resumetailor.infrastructure.optimization.enhancement.EnhancementTemplateRegistry;
import com.resumetailor.infrastructure.optimization.enhancement.SentenceDeduplicator;
import com.resumetailor.infrastructure.optimization.keyword.GapAnalyzer;
import com.resumetailor.infrastructure.optimization.keyword.KeywordExtractor;
import com.resumetailor.infrastructure.optimization.keyword.KeywordMatcher;
import com.resumetailor.infrastructure.optimization.preprocessing.TextNormalizer;
import com.resumetailor.infrastructure.optimization.section.SectionClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeOptimizationEngineTest {

    private static final ResumeDocument SHORT_RESUME = ResumeDocument.ofTexts(
            "Jane Doe",
            "SKILLS",
            "Python | Java | Git",
            "EXPERIENCE",
            "Backend engineer building payment services.");

    private static final String PLATFORM_JD = "We are hiring a platform engineer. Docker, Kubernetes, CI/CD. "
            + "You will run Docker and Kubernetes in production and own CI/CD pipelines.";

    private static final ResumeDocument FULL_RESUME = ResumeDocument.ofTexts(
            "Jane Doe",
            "jane@example.com | 555-0100",
            "",
            "Summary",
            "Backend engineer focused on payment platforms.",
            "Technical Skills",
            "Python | Java | Git",
            "Experience",
            "Built payment APIs at Acme.",
            "Mentored two junior developers and ran weekly design reviews for the payments team.",
            "",
            "Education",
            "BSc Computer Science, State University");

    private static final String BACKEND_JD = "Senior backend engineer. Requirements: Docker, Kubernetes, Terraform, "
            + "AWS, Kafka, PostgreSQL, Redis, GraphQL, gRPC, Prometheus, Grafana, Helm, Jenkins, Ansible, "
            + "Elasticsearch, Spark, Airflow. Docker and Kubernetes experience is essential. "
            + "AWS and Terraform for infrastructure. Kafka for streaming.";

    private static final Pattern CHANGE_KEYWORD = Pattern.compile("Added '(.+)' to ");

    @Mock
    private DocumentStore documentStore;

    @Mock
    private GapAnalyzer mockedGapAnalyzer;

    private TextNormalizer textNormalizer;
    private KeywordMatcher keywordMatcher;

    @BeforeEach
    void setUp() {
        textNormalizer = new TextNormalizer();
        keywordMatcher = new KeywordMatcher(textNormalizer);
    }

    private ResumeOptimizationEngine engine(OptimizerSettings settings) {
        GapAnalyzer gapAnalyzer = new GapAnalyzer(new KeywordExtractor(textNormalizer), keywordMatcher, settings);
        return engine(settings, gapAnalyzer);
    }

    private ResumeOptimizationEngine engine(OptimizerSettings settings, GapAnalyzer gapAnalyzer) {
        ContextualEnhancer enhancer = new ContextualEnhancer(new DensityGuard(keywordMatcher), keywordMatcher,
                new EnhancementTemplateRegistry(), context -> List.of(), settings);
        DocumentRebuilder rebuilder = new DocumentRebuilder(new SectionClassifier(), enhancer,
                new SentenceDeduplicator(), keywordMatcher, settings);
        return new ResumeOptimizationEngine(gapAnalyzer, rebuilder, documentStore, settings);
    }

    private ResumeOptimizationEngine engine() {
        return engine(OptimizerSettings.defaults());
    }

    private static String keywordOf(String change) {
        Matcher m = CHANGE_KEYWORD.matcher(change);
        assertThat(m.find()).as("change entry '%s'", change).isTrue();
        return m.group(1);
    }

    // ── Insertion ──

    @Nested
    @DisplayName("Keyword insertion")
    class Insertion {

        @Test
        @DisplayName("Missing tools are appended to the skills list")
        void skills_list_extended() {
            OptimizationResult result = engine().optimize(SHORT_RESUME, PLATFORM_JD);

            assertThat(result.document().get(2).text())
                    .startsWith("Python | Java | Git | Docker | Kubernetes | CICD");
            assertThat(result.keywordsAdded()).isGreaterThanOrEqualTo(3);
            assertThat(result.keywordsAdded()).isEqualTo(result.changes().size());
            assertThat(result.changes()).startsWith(
                    "Added 'Docker' to skills.", "Added 'Kubernetes' to skills.", "Added 'CICD' to skills.");
        }

        @Test
        @DisplayName("Name line and headers are untouched")
        void headers_and_name_untouched() {
            OptimizationResult result = engine().optimize(SHORT_RESUME, PLATFORM_JD);

            assertThat(result.document().get(0).text()).isEqualTo("Jane Doe");
            assertThat(result.document().get(1).text()).isEqualTo("SKILLS");
            assertThat(result.document().get(3).text()).isEqualTo("EXPERIENCE");
        }

        @Test
        @DisplayName("Each inserted keyword occurs exactly once in the output")
        void each_keyword_once() {
            OptimizationResult result = engine().optimize(FULL_RESUME, BACKEND_JD);

            assertThat(result.changes()).isNotEmpty();
            for (String change : result.changes()) {
                String keyword = keywordOf(change);
                assertThat(keywordMatcher.countOccurrences(result.document().fullText(), keyword))
                        .as("occurrences of %s", keyword)
                        .isEqualTo(1);
            }
        }

        @Test
        @DisplayName("Output is deterministic")
        void deterministic() {
            OptimizationResult first = engine().optimize(FULL_RESUME, BACKEND_JD);
            OptimizationResult second = engine().optimize(FULL_RESUME, BACKEND_JD);

            assertThat(second.document().texts()).isEqualTo(first.document().texts());
            assertThat(second.changes()).isEqualTo(first.changes());
        }
    }

    // ── Limits ──

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("Default ceiling of 15 insertions")
        void default_ceiling() {
            OptimizationResult result = engine().optimize(FULL_RESUME, BACKEND_JD);

            assertThat(result.keywordsAdded()).isBetween(1, 15);
        }

        @Test
        @DisplayName("Configured ceiling is exact when enough candidates exist")
        void configured_ceiling() {
            OptimizationResult result = engine(OptimizerSettings.defaults().withMaxKeywordsAdded(3))
                    .optimize(FULL_RESUME, BACKEND_JD);

            assertThat(result.keywordsAdded()).isEqualTo(3);
            assertThat(result.changes()).containsExactly(
                    "Added 'Docker' to summary.",
                    "Added 'Kubernetes' to summary.",
                    "Added 'Terraform' to skills.");
        }

        @Test
        @DisplayName("Dense paragraphs and zero-budget sections stay as they were")
        void density_and_budget() {
            OptimizationResult result = engine().optimize(FULL_RESUME, BACKEND_JD);
            ResumeDocument out = result.document();

            assertThat(out.get(9).text()).isEqualTo(FULL_RESUME.get(9).text());
            assertThat(out.get(12).text()).isEqualTo("BSc Computer Science, State University");
        }
    }

    // ── Structure ──

    @Test
    @DisplayName("Paragraph count, blanks, headers and contact lines are preserved")
    void structure_preserved() {
        ResumeDocument out = engine().optimize(FULL_RESUME, BACKEND_JD).document();

        assertThat(out.size()).isEqualTo(FULL_RESUME.size());
        for (int i : new int[]{0, 1, 2, 3, 5, 7, 10, 11}) {
            assertThat(out.get(i).text()).isEqualTo(FULL_RESUME.get(i).text());
        }
        assertThat(out.get(4).text()).startsWith("Backend engineer focused on payment platforms.");
        assertThat(out.get(6).text()).startsWith("Python | Java | Git");
    }

    // ── Unchanged results ──

    @Nested
    @DisplayName("Nothing to do")
    class NothingToDo {

        @Test
        @DisplayName("Resume already covering the job description is returned unchanged")
        void already_covered() {
            ResumeDocument resume = ResumeDocument.ofTexts(
                    "Skills", "Docker, Kubernetes, Terraform", "Ran production workloads with automated provisioning.");
            String jd = "Docker, Kubernetes, Terraform. Docker and Kubernetes for production workloads, "
                    + "Terraform for provisioning.";

            OptimizationResult result = engine().optimize(resume, jd);

            assertThat(result.document().texts()).isEqualTo(resume.texts());
            assertThat(result.keywordsAdded()).isZero();
            assertThat(result.changes()).isEmpty();
        }

        @Test
        @DisplayName("Job description without usable keywords returns the resume unchanged")
        void degraded_job_description() {
            String jd = "We are looking for someone who is able to join the team and work with us.";

            OptimizationResult result = engine().optimize(SHORT_RESUME, jd);

            assertThat(result.document()).isSameAs(SHORT_RESUME);
            assertThat(result.keywordsAdded()).isZero();
        }
    }

    // ── Validation ──

    @Nested
    @DisplayName("Input validation")
    class Validation {

        @Test
        @DisplayName("Short job description fails before any extraction")
        void short_job_description() {
            ResumeOptimizationEngine engine = engine(OptimizerSettings.defaults(), mockedGapAnalyzer);

            assertThatThrownBy(() -> engine.optimize(SHORT_RESUME, "Java developer needed"))
                    .isInstanceOf(ResumeInputException.class)
                    .hasMessageContaining("too short");
            verifyNoInteractions(mockedGapAnalyzer);
        }

        @Test
        @DisplayName("Punctuation counts toward the minimum job-description length")
        void punctuation_heavy_job_description_at_minimum() {
            String jd = "Docker, Kubernetes, CI/CD, Terraform, AWS, GCP, Go";
            assertThat(jd).hasSize(50);

            OptimizationResult result = engine().optimize(ResumeDocument.ofTexts("SKILLS", "Python | Java | Git"), jd);

            assertThat(result.keywordsAdded()).isPositive();
            assertThat(result.document().get(1).text()).startsWith("Python | Java | Git | Docker");
        }

        @Test
        @DisplayName("Null job description is too short")
        void null_job_description() {
            assertThatThrownBy(() -> engine().optimize(SHORT_RESUME, null))
                    .isInstanceOf(ResumeInputException.class);
        }

        @Test
        @DisplayName("Resume without text is rejected")
        void empty_resume() {
            assertThatThrownBy(() -> engine().optimize(ResumeDocument.ofTexts("", "  "), PLATFORM_JD))
                    .isInstanceOf(ResumeInputException.class)
                    .hasMessage("Resume contains no text");
        }

        @Test
        @DisplayName("missingKeywords validates the job description too")
        void missing_keywords_validation() {
            assertThatThrownBy(() -> engine().missingKeywords("Python developer", "too short"))
                    .isInstanceOf(ResumeInputException.class);
        }
    }

    // ── File round trip ──

    @Nested
    @DisplayName("optimizeFile")
    class OptimizeFile {

        private final Path source = Path.of("resume.docx");
        private final Path target = Path.of("out", "resume-optimized.docx");

        @Test
        @DisplayName("Reads the source, writes the optimized document to the target")
        void read_optimize_write() {
            when(documentStore.read(source)).thenReturn(SHORT_RESUME);

            OptimizationResult result = engine().optimizeFile(source, PLATFORM_JD, target);

            verify(documentStore).write(result.document(), target);
            assertThat(result.keywordsAdded()).isPositive();
        }

        @Test
        @DisplayName("Target equal to the source is rejected")
        void same_path_rejected() {
            assertThatThrownBy(() -> engine().optimizeFile(source, PLATFORM_JD, Path.of("./resume.docx")))
                    .isInstanceOf(ResumeInputException.class);
            verifyNoInteractions(documentStore);
        }

        @Test
        @DisplayName("Short job description fails before the file is read")
        void short_job_description() {
            assertThatThrownBy(() -> engine().optimizeFile(source, "short", target))
                    .isInstanceOf(ResumeInputException.class);
            verifyNoInteractions(documentStore);
        }
    }

    @Test
    @DisplayName("missingKeywords lists candidates in job-description order")
    void missing_keywords() {
        List<Keyword> missing = engine().missingKeywords(SHORT_RESUME.fullText(), PLATFORM_JD);

        assertThat(missing).extracting(Keyword::text).startsWith("Docker", "Kubernetes", "CICD");
    }
}
