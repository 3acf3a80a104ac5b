package com.attorneyroster.scrape.extract;

import com.attorneyroster.scrape.TestJurisdictions;
import com.attorneyroster.scrape.model.CandidateField;
import com.attorneyroster.scrape.model.CandidateRecord;
import com.attorneyroster.scrape.model.JurisdictionDefinition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionPipelineTest {
    private final JurisdictionDefinition texas = TestJurisdictions.texas();

    @Mock
    private ExtractionStrategy first;

    @Mock
    private ExtractionStrategy second;

    @Test
    void blockSelectorWinsOverTableWhenBothArePresent() {
        String html = """
            <html><body>
              <div class="attorney-result"><h3>Jane Roe</h3><p>Bar No: 24012345</p></div>
              <table class="results">
                <tr><th>Name</th><th>Bar</th></tr>
                <tr><td><a href="/m?BarNumber=11111111">Table Person</a></td><td>11111111</td></tr>
              </table>
            </body></html>
            """;

        PageExtraction extraction = new ExtractionPipeline(new ResultBlockParser()).extract(html, "https://www.texasbar.com/", texas);

        assertThat(extraction.strategy()).isEqualTo("result_block");
        assertThat(extraction.candidates()).hasSize(1);
        assertThat(extraction.candidates().get(0).getOrNull(CandidateField.FULL_NAME)).isEqualTo("Jane Roe");
    }

    @Test
    void laterStrategiesAreNotConsultedOnceOneMatches() {
        Document document = Jsoup.parse("<div><h3>John Doe</h3></div>");
        Element block = document.selectFirst("div");
        when(first.tryExtract(any())).thenReturn(Optional.of(List.of(block)));
        when(first.name()).thenReturn("first");

        PageExtraction extraction = new ExtractionPipeline(List.of(first, second), new ResultBlockParser())
            .extract(document, texas);

        assertThat(extraction.strategy()).isEqualTo("first");
        assertThat(extraction.candidates()).hasSize(1);
        verify(second, never()).tryExtract(any());
    }

    @Test
    void tableOnlyPageYieldsEveryRowAfterTheHeader() {
        String html = """
            <table id="memberResults">
              <tr><th>Name</th><th>Bar Number</th><th>City</th></tr>
              <tr><td><a href="/profile?BarNumber=24000001">Ann Lee</a></td><td>24000001</td><td>Houston</td></tr>
              <tr><td><a href="/profile?BarNumber=24000002">Bo Chen</a></td><td>24000002</td><td>Dallas</td></tr>
              <tr><td><a href="/profile?BarNumber=24000003">Cy Diaz</a></td><td>24000003</td><td>Austin</td></tr>
            </table>
            """;

        PageExtraction extraction = new ExtractionPipeline(new ResultBlockParser()).extract(html, "https://www.texasbar.com/", texas);

        assertThat(extraction.strategy()).isEqualTo("result_table");
        assertThat(extraction.blocksMatched()).isEqualTo(3);
        assertThat(extraction.candidates())
            .extracting(candidate -> candidate.getOrNull(CandidateField.FULL_NAME))
            .containsExactly("Ann Lee", "Bo Chen", "Cy Diaz");
    }

    @Test
    void namelessBlocksAreRejected() {
        String html = """
            <div class="member-listing"><h3>Named Lawyer</h3></div>
            <div class="member-listing"><p>Bar No: 24099999</p></div>
            """;

        PageExtraction extraction = new ExtractionPipeline(new ResultBlockParser()).extract(html, "https://www.texasbar.com/", texas);

        assertThat(extraction.blocksMatched()).isEqualTo(2);
        assertThat(extraction.candidates()).hasSize(1);
        assertThat(extraction.rejectedBlocks()).isEqualTo(1);
    }

    @Test
    void blockThatThrowsIsSkipped() {
        Document document = Jsoup.parse("<div><h3>Good</h3></div><div><h3>Bad</h3></div>");
        List<Element> blocks = document.select("div");
        when(first.tryExtract(any())).thenReturn(Optional.of(blocks));
        when(first.name()).thenReturn("first");
        ResultBlockParser parser = new ResultBlockParser() {
            @Override
            public Optional<CandidateRecord> parse(Element block, JurisdictionDefinition jurisdiction) {
                if (block.text().equals("Bad")) {
                    throw new IllegalStateException("broken markup");
                }
                return super.parse(block, jurisdiction);
            }
        };

        PageExtraction extraction = new ExtractionPipeline(List.of(first), parser).extract(document, texas);

        assertThat(extraction.candidates()).hasSize(1);
        assertThat(extraction.candidates().get(0).getOrNull(CandidateField.FULL_NAME)).isEqualTo("Good");
    }

    @Test
    void unrecognizedMarkupYieldsNothing() {
        PageExtraction extraction = new ExtractionPipeline(new ResultBlockParser())
            .extract("<p>No attorneys matched your search.</p>", "https://www.texasbar.com/", texas);

        assertThat(extraction.strategy()).isNull();
        assertThat(extraction.candidates()).isEmpty();
    }
}
