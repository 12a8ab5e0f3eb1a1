package io.github.drompincen.boardpilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document(collection = "style_guides")
public class StyleGuideDocument {

    @Id
    private String styleGuideId;
    @Indexed(unique = true)
    private String projectId;
    private String variableCase;
    private String functionCase;
    private String classCase;
    private String constantCase;
    private String fileCase;
    private String indentStyle;     // "spaces" or "tabs"
    private int indentSize;
    private int maxLineLength;
    private boolean semicolons;
    private boolean singleQuotes;
    private String dateFormat;
    private String numberFormat;
    private int maxFunctionLength;
    private int maxFileLength;
    private boolean requireDocstrings;
    private String testNamingPattern;
    private String primaryLanguage;
    private List<String> frameworks;
    private Instant updatedAt;

    public StyleGuideDocument() {}

    public String getStyleGuideId() { return styleGuideId; }
    public void setStyleGuideId(String styleGuideId) { this.styleGuideId = styleGuideId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getVariableCase() { return variableCase; }
    public void setVariableCase(String variableCase) { this.variableCase = variableCase; }

    public String getFunctionCase() { return functionCase; }
    public void setFunctionCase(String functionCase) { this.functionCase = functionCase; }

    public String getClassCase() { return classCase; }
    public void setClassCase(String classCase) { this.classCase = classCase; }

    public String getConstantCase() { return constantCase; }
    public void setConstantCase(String constantCase) { this.constantCase = constantCase; }

    public String getFileCase() { return fileCase; }
    public void setFileCase(String fileCase) { this.fileCase = fileCase; }

    public String getIndentStyle() { return indentStyle; }
    public void setIndentStyle(String indentStyle) { this.indentStyle = indentStyle; }

    public int getIndentSize() { return indentSize; }
    public void setIndentSize(int indentSize) { this.indentSize = indentSize; }

    public int getMaxLineLength() { return maxLineLength; }
    public void setMaxLineLength(int maxLineLength) { this.maxLineLength = maxLineLength; }

    public boolean isSemicolons() { return semicolons; }
    public void setSemicolons(boolean semicolons) { this.semicolons = semicolons; }

    public boolean isSingleQuotes() { return singleQuotes; }
    public void setSingleQuotes(boolean singleQuotes) { this.singleQuotes = singleQuotes; }

    public String getDateFormat() { return dateFormat; }
    public void setDateFormat(String dateFormat) { this.dateFormat = dateFormat; }

    public String getNumberFormat() { return numberFormat; }
    public void setNumberFormat(String numberFormat) { this.numberFormat = numberFormat; }

    public int getMaxFunctionLength() { return maxFunctionLength; }
    public void setMaxFunctionLength(int maxFunctionLength) { this.maxFunctionLength = maxFunctionLength; }

    public int getMaxFileLength() { return maxFileLength; }
    public void setMaxFileLength(int maxFileLength) { this.maxFileLength = maxFileLength; }

    public boolean isRequireDocstrings() { return requireDocstrings; }
    public void setRequireDocstrings(boolean requireDocstrings) { this.requireDocstrings = requireDocstrings; }

    public String getTestNamingPattern() { return testNamingPattern; }
    public void setTestNamingPattern(String testNamingPattern) { this.testNamingPattern = testNamingPattern; }

    public String getPrimaryLanguage() { return primaryLanguage; }
    public void setPrimaryLanguage(String primaryLanguage) { this.primaryLanguage = primaryLanguage; }

    public List<String> getFrameworks() { return frameworks; }
    public void setFrameworks(List<String> frameworks) { this.frameworks = frameworks; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
