package com.attorneyroster.scrape.extract;

import com.attorneyroster.scrape.TestJurisdictions;
import com.attorneyroster.scrape.model.CandidateField;
import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultBlockParserTest {
    private final ResultBlockParser parser = new ResultBlockParser();
    private final JurisdictionDefinition texas = TestJurisdictions.texas();

    @Test
    void readsLabelledFieldsFromFreeFormBlock() {
        Element block = firstBlock("""
            <div class="attorney-result">
              <h3><a href="/profile?BarNumber=24055555">Maria Garcia</a></h3>
              <p>Bar Number: 24055555</p>
              <p>Firm: Garcia &amp; Partners LLP</p>
              <p><strong>Status:</strong> Eligible to Practice in Texas</p>
              <p>Admitted: 05/01/2010</p>
              <p>Law School: University of Texas School of Law</p>
              <div class="address">100 Congress Ave, Austin, TX 78701</div>
              <p>Phone: <a href="tel:+15125550100">(512) 555-0100</a></p>
              <p><a href="mailto:maria@garcia.example?subject=Hi">Email</a> <a href="https://garcia.example/">Web Site</a></p>
              <ul class="practice-areas"><li>Litigation</li><li>Family Law</li></ul>
            </div>
            """, ".attorney-result");

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertEquals("Maria Garcia", record.getOrNull(CandidateField.FULL_NAME));
        assertEquals("24055555", record.getOrNull(CandidateField.BAR_NUMBER));
        assertEquals("Austin", record.getOrNull(CandidateField.CITY));
        assertEquals("Garcia & Partners LLP", record.getOrNull(CandidateField.FIRM_NAME));
        assertEquals("Eligible to Practice in Texas", record.getOrNull(CandidateField.STATUS));
        assertEquals("05/01/2010", record.getOrNull(CandidateField.ADMISSION_DATE));
        assertEquals("University of Texas School of Law", record.getOrNull(CandidateField.LAW_SCHOOL));
        assertEquals("100 Congress Ave, Austin, TX 78701", record.getOrNull(CandidateField.ADDRESS));
        assertEquals("(512) 555-0100", record.getOrNull(CandidateField.PHONE));
        assertEquals("maria@garcia.example", record.getOrNull(CandidateField.EMAIL));
        assertThat(record.getOrNull(CandidateField.WEBSITE)).startsWith("https://garcia.example");
        assertThat(record.practiceAreas()).containsExactly("Litigation", "Family Law");
    }

    @Test
    void missingFieldsStayAbsent() {
        Element block = firstBlock("<div class=\"member\"><strong>Lee Wong</strong></div>", ".member");

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertEquals("Lee Wong", record.getOrNull(CandidateField.FULL_NAME));
        assertNull(record.getOrNull(CandidateField.STATUS));
        assertNull(record.getOrNull(CandidateField.BAR_NUMBER));
        assertNull(record.getOrNull(CandidateField.CITY));
        assertTrue(record.practiceAreas().isEmpty());
    }

    @Test
    void readsBareBarNumberAndCityFromText() {
        Element block = firstBlock(
            "<div class=\"member\"><strong>Lee Wong</strong> 24033333 Dallas</div>",
            ".member"
        );

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertEquals("24033333", record.getOrNull(CandidateField.BAR_NUMBER));
        assertEquals("Dallas", record.getOrNull(CandidateField.CITY));
    }

    @Test
    void firmIsReadFromTheElementAfterItsLabel() {
        Element block = firstBlock("""
            <div class="member">
              <h4>Lee Wong</h4>
              <dl><dt>Company</dt><dd>Wong Law PLLC</dd></dl>
              <p>Practice Areas: Tax; Estate Planning | Probate</p>
            </div>
            """, ".member");

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertEquals("Wong Law PLLC", record.getOrNull(CandidateField.FIRM_NAME));
        assertThat(record.practiceAreas()).containsExactly("Tax", "Estate Planning", "Probate");
    }

    @Test
    void tableRowUsesLinkForNameAndCellsForBarAndCity() {
        Element row = Jsoup.parse("""
            <table class="results">
              <tr><th>Name</th><th>Bar</th><th>City</th><th>Email</th></tr>
              <tr>
                <td><a href="/Profile.cfm?BarNumber=24011111">Pat Kim</a></td>
                <td>24011111</td>
                <td>SAN ANTONIO</td>
                <td><a href="mailto:pat@kim.example">pat@kim.example</a></td>
              </tr>
            </table>
            """).select("tr").get(1);

        CandidateRecord record = parser.parse(row, texas).orElseThrow();

        assertEquals("Pat Kim", record.getOrNull(CandidateField.FULL_NAME));
        assertEquals("24011111", record.getOrNull(CandidateField.BAR_NUMBER));
        assertEquals("SAN ANTONIO", record.getOrNull(CandidateField.CITY));
        assertEquals("pat@kim.example", record.getOrNull(CandidateField.EMAIL));
        assertNull(record.getOrNull(CandidateField.STATUS));
    }

    @Test
    void wordsLikeFirmOrCountyInsideValuesAreNotLabels() {
        Element block = firstBlock("""
            <div class="member">
              <h3>Jane Doe</h3>
              <p>Smith Law Firm, PLLC</p>
              <p>Travis County, TX</p>
            </div>
            """, ".member");

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertNull(record.getOrNull(CandidateField.FIRM_NAME));
        assertNull(record.getOrNull(CandidateField.COUNTY));
    }

    @Test
    void labelledFirmValueMayContainTheLabelWord() {
        Element block = firstBlock("""
            <div class="member">
              <h3>Jane Doe</h3>
              <p>Travis County, TX</p>
              <p>Firm: Smith Law Firm, PLLC</p>
              <p>County: Travis</p>
            </div>
            """, ".member");

        CandidateRecord record = parser.parse(block, texas).orElseThrow();

        assertEquals("Smith Law Firm, PLLC", record.getOrNull(CandidateField.FIRM_NAME));
        assertEquals("Travis", record.getOrNull(CandidateField.COUNTY));
    }

    @Test
    void tableRowPicksUpLabelledCellsAndPracticeAreas() {
        Element row = Jsoup.parse("""
            <table class="results">
              <tr><th>Name</th><th>Status</th><th>Practice</th><th>School</th></tr>
              <tr>
                <td><a href="/p?BarNumber=24011111">Ann Lee</a></td>
                <td>Status: Active</td>
                <td class="practice-areas">Tax; Probate</td>
                <td>Law School: Baylor Law</td>
              </tr>
            </table>
            """).select("tr").get(1);

        CandidateRecord record = parser.parse(row, texas).orElseThrow();

        assertEquals("24011111", record.getOrNull(CandidateField.BAR_NUMBER));
        assertEquals("Active", record.getOrNull(CandidateField.STATUS));
        assertEquals("Baylor Law", record.getOrNull(CandidateField.LAW_SCHOOL));
        assertThat(record.practiceAreas()).containsExactly("Tax", "Probate");
    }

    @Test
    void tableRowWithoutLinkIsRejected() {
        Element row = Jsoup.parse("""
            <table class="results">
              <tr><th>Bar</th><th>City</th></tr>
              <tr><td>24011111</td><td>Houston</td></tr>
            </table>
            """).select("tr").get(1);

        Optional<CandidateRecord> record = parser.parse(row, texas);

        assertTrue(record.isEmpty());
    }

    @Test
    void barNumberRequiresExactDigitCountAndPrefersLabel() {
        assertNull(parser.findBarNumber("Ref 123456789", 8));
        assertEquals("24000002", parser.findBarNumber("Phone 12345678 Bar No. 24000002", 8));
        assertEquals("12345678", parser.findBarNumber("Phone 12345678", 8));
        assertNull(parser.findBarNumber(null, 8));
    }

    private Element firstBlock(String html, String selector) {
        return Jsoup.parse(html, "https://www.texasbar.com/").selectFirst(selector);
    }
}
