package io.evitadb.irasutoya.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DirectoryPaths should derive image locations from publication date and URL")
public class DirectoryPathsTest {

	@Test
	@DisplayName("shouldBuildPathFromYearMonthAndFilename")
	void shouldBuildPathFromYearMonthAndFilename() {
		assertEquals(
			"./images/2016/10/taimatsu_olympic.png",
			DirectoryPaths.resolve("2016-10-05T12:00:00+09:00", "https://example.org/img/taimatsu_olympic.png")
		);
	}

	@Test
	@DisplayName("shouldAcceptYearMonthOnly")
	void shouldAcceptYearMonthOnly() {
		assertEquals(
			"./images/2016/10/taimatsu_olympic.png",
			DirectoryPaths.resolve("2016-10", "https://example.org/img/taimatsu_olympic.png")
		);
	}

	@Test
	@DisplayName("shouldKeepPercentEncodedFileNameAsWritten")
	void shouldKeepPercentEncodedFileNameAsWritten() {
		assertEquals(
			"./images/2016/10/%E3%81%9F%E3%81%84%E3%81%BE%E3%81%A4.png",
			DirectoryPaths.resolve("2016-10-05", "https://example.org/s800/%E3%81%9F%E3%81%84%E3%81%BE%E3%81%A4.png")
		);
		assertEquals(
			"./images/2016/10/a%2Fb.png",
			DirectoryPaths.resolve("2016-10-05", "https://example.org/s800/a%2Fb.png")
		);
	}

	@Test
	@DisplayName("shouldIgnoreQueryAndFragmentOfImageUrl")
	void shouldIgnoreQueryAndFragmentOfImageUrl() {
		assertEquals(
			"./images/2019/03/sakura.jpg",
			DirectoryPaths.resolve("2019-03-21", "https://example.org/s800/sakura.jpg?size=large#top")
		);
	}

	@Test
	@DisplayName("shouldKeepMonthDigitsAsWritten")
	void shouldKeepMonthDigitsAsWritten() {
		assertEquals("3", DirectoryPaths.parseYearMonth("2019-3-21").month());
		assertEquals("03", DirectoryPaths.parseYearMonth("2019-03-21 10:00").month());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "   ", "October 2016", "2016/10/05", "2016-13-01", "2016-00"})
	@DisplayName("shouldRejectUnusablePublicationDate")
	void shouldRejectUnusablePublicationDate(String publishedAt) {
		assertThrows(IllegalArgumentException.class, () ->
			DirectoryPaths.resolve(publishedAt, "https://example.org/a.png")
		);
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "https://example.org/", "https://example.org/img/.."})
	@DisplayName("shouldRejectImageUrlWithoutFilename")
	void shouldRejectImageUrlWithoutFilename(String imageUrl) {
		assertThrows(IllegalArgumentException.class, () -> DirectoryPaths.resolve("2016-10", imageUrl));
	}

	@Test
	@DisplayName("shouldRejectMissingValues")
	void shouldRejectMissingValues() {
		assertThrows(IllegalArgumentException.class, () -> DirectoryPaths.resolve(null, "https://example.org/a.png"));
		assertThrows(IllegalArgumentException.class, () -> DirectoryPaths.resolve("2016-10", null));
	}
}
