package com.kendb3.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "Profile, profile",
            "MinecraftVersion, minecraft_version",
            "SubmissionRevision, submission_revision",
            "URLShortener, u_r_l_shortener"
    })
    void testToApiName(String typeName, String expected) {
        assertThat(NamingUtil.toApiName(typeName)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "revisionOf, revision_of",
            "make, make",
            "DISPLAY_NAME, display_name",
            "TEXT, text",
            "isCommon, is_common"
    })
    void testToFieldName(String memberName, String expected) {
        assertThat(NamingUtil.toFieldName(memberName)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "design_desc, DesignDesc",
            "user, User",
            "revision-of, RevisionOf"
    })
    void testToPascalCase(String input, String pascal) {
        assertThat(NamingUtil.toPascalCase(input)).isEqualTo(pascal);
    }
}
