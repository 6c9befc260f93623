package com.coach.linkage.importer;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.core.model.School;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One coach row of an import preview. The school assignment and the include flag are
 * edited by the operator before the batch is committed.
 */
public class ImportRow {
    private final int rowNumber;
    private final String originalSchool;
    private final String firstName;
    private final String lastName;
    private final String email;
    private final String phone;
    private final String title;
    private final List<String> warnings;

    private School matchedSchool;
    private ConfidenceTier tier;
    private boolean include;

    public ImportRow(int rowNumber, String originalSchool, String firstName, String lastName,
                     String email, String phone, String title, List<String> warnings) {
        this.rowNumber = rowNumber;
        this.originalSchool = originalSchool;
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phone = phone;
        this.title = title;
        this.warnings = new ArrayList<>(warnings);
        this.tier = ConfidenceTier.NONE;
    }

    /**
     * Spreadsheet line number, counting the header as line 1.
     */
    public int getRowNumber() {
        return rowNumber;
    }

    public String getOriginalSchool() {
        return originalSchool;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public School getMatchedSchool() {
        return matchedSchool;
    }

    public ConfidenceTier getTier() {
        return tier;
    }

    public boolean isInclude() {
        return include;
    }

    public boolean isMatched() {
        return matchedSchool != null;
    }

    void applyMatch(SchoolMatch match) {
        this.matchedSchool = match.school();
        this.tier = match.tier();
        this.include = true;
    }

    void assignManually(School school) {
        this.matchedSchool = school;
        this.tier = ConfidenceTier.MANUAL;
        this.include = true;
    }

    void clearSchool() {
        this.matchedSchool = null;
        this.tier = ConfidenceTier.NONE;
        this.include = false;
    }

    void setInclude(boolean include) {
        this.include = include;
    }

    /**
     * Display name of the coach, as shown in the preview.
     */
    public String coachName() {
        return (firstName + " " + lastName).trim();
    }

    @Override
    public String toString() {
        return "ImportRow{row=" + rowNumber +
                ", school='" + originalSchool + '\'' +
                ", name='" + coachName() + '\'' +
                ", tier=" + tier +
                ", include=" + include + '}';
    }
}
