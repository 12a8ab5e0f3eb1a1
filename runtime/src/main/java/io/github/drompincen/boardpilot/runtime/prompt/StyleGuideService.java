package io.github.drompincen.boardpilot.runtime.prompt;

import io.github.drompincen.boardpilot.persistence.document.StyleGuideDocument;
import io.github.drompincen.boardpilot.persistence.repository.StyleGuideRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class StyleGuideService {

    private static final Map<String, String> CASE_EXAMPLES = Map.of(
            "camelCase", "myVariableName",
            "PascalCase", "MyClassName",
            "snake_case", "my_variable_name",
            "UPPER_SNAKE", "MY_CONSTANT_VALUE",
            "kebab-case", "my-file-name");

    private final StyleGuideRepository styleGuideRepository;

    public StyleGuideService(StyleGuideRepository styleGuideRepository) {
        this.styleGuideRepository = styleGuideRepository;
    }

    public Optional<StyleGuideDocument> getStyleGuide(String projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        return styleGuideRepository.findByProjectId(projectId);
    }

    public String formatForPrompt(StyleGuideDocument guide) {
        StringBuilder sb = new StringBuilder("## Project Style Guide\n\n");
        sb.append("### Naming Conventions\n");
        namingLine(sb, "Variables", guide.getVariableCase());
        namingLine(sb, "Functions", guide.getFunctionCase());
        namingLine(sb, "Classes", guide.getClassCase());
        namingLine(sb, "Constants", guide.getConstantCase());
        namingLine(sb, "Files", guide.getFileCase());

        sb.append("\n### Formatting\n");
        sb.append("- Indentation: ").append(guide.getIndentSize()).append(' ')
                .append(orDefault(guide.getIndentStyle(), "spaces")).append('\n');
        sb.append("- Max line length: ").append(guide.getMaxLineLength()).append(" characters\n");
        sb.append("- Semicolons: ").append(guide.isSemicolons() ? "required" : "not used").append('\n');
        sb.append("- Quotes: ").append(guide.isSingleQuotes() ? "single quotes" : "double quotes").append('\n');

        sb.append("\n### Data Formats\n");
        sb.append("- Dates: ").append(orDefault(guide.getDateFormat(), "ISO-8601")).append(" format\n");
        sb.append("- Numbers: ").append(orDefault(guide.getNumberFormat(), "locale default")).append('\n');

        sb.append("\n### Code Standards\n");
        sb.append("- Max function length: ").append(guide.getMaxFunctionLength()).append(" lines\n");
        sb.append("- Max file length: ").append(guide.getMaxFileLength()).append(" lines\n");
        sb.append("- Docstrings: ").append(guide.isRequireDocstrings() ? "required" : "optional").append('\n');
        sb.append("- Test naming: ").append(orDefault(guide.getTestNamingPattern(), "not specified")).append('\n');

        sb.append("\n### Language & Frameworks\n");
        sb.append("- Primary language: ").append(orDefault(guide.getPrimaryLanguage(), "not specified")).append('\n');
        List<String> frameworks = guide.getFrameworks();
        sb.append("- Frameworks: ")
                .append(frameworks == null || frameworks.isEmpty() ? "none specified" : String.join(", ", frameworks))
                .append('\n');
        return sb.toString();
    }

    private static void namingLine(StringBuilder sb, String label, String caseStyle) {
        if (caseStyle == null) {
            return;
        }
        sb.append("- ").append(label).append(": ").append(caseStyle);
        String example = CASE_EXAMPLES.get(caseStyle);
        if (example != null) {
            sb.append(" (e.g., ").append(example).append(')');
        }
        sb.append('\n');
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
