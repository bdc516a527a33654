package io.evitadb.irasutoya;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.evitadb.irasutoya.error.CorruptDataException;
import io.evitadb.irasutoya.model.Illustration;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RecordStore reads and writes the catalogue document: a UTF-8 JSON array of illustration records.
 *
 * Writes are atomic. The collection is written to a temporary file next to the target, flushed to disk
 * and then moved over the target, so a crash during {@link #save(List, Path)} leaves either the previous
 * or the new document in place, never a truncated one.
 */
public final class RecordStore {

	private static final TypeReference<List<Illustration>> RECORD_LIST = new TypeReference<>() {};
	private static final String TEMP_SUFFIX = ".tmp";

	@Nonnull
	private final ObjectMapper mapper;
	@Nonnull
	private final ObjectWriter writer;

	public RecordStore() {
		this.mapper = JsonMapper.builder()
			.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
			.build();
		final DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
		final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
		printer.indentObjectsWith(indenter);
		printer.indentArraysWith(indenter);
		this.writer = this.mapper.writerFor(RECORD_LIST).with(printer);
	}

	/**
	 * Loads all records from the document. A missing document is a first run and yields an empty list.
	 *
	 * @param file the document to read
	 * @return mutable list of records in document order
	 * @throws CorruptDataException if the document is not a JSON array of records
	 * @throws IOException          if the document cannot be read
	 */
	@Nonnull
	public List<Illustration> load(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");

		if (!Files.exists(file)) {
			return new ArrayList<>();
		}
		if (Files.isDirectory(file)) {
			throw new CorruptDataException(file, "path is a directory", null);
		}

		final List<Illustration> records;
		try (final InputStream in = Files.newInputStream(file)) {
			records = this.mapper.readValue(in, RECORD_LIST);
		} catch (JsonProcessingException e) {
			throw new CorruptDataException(file, e.getOriginalMessage(), e);
		}
		if (records == null) {
			throw new CorruptDataException(file, "document is null", null);
		}
		for (int i = 0; i < records.size(); i++) {
			if (records.get(i) == null) {
				throw new CorruptDataException(file, "record at index " + i + " is null", null);
			}
		}
		return new ArrayList<>(records);
	}

	/**
	 * Writes the full collection to the document, replacing its previous content atomically.
	 * Parent directories are created when missing.
	 *
	 * @param records the records to write, in order
	 * @param file    the target document
	 * @throws IOException if the document cannot be written; the previous content is left intact
	 */
	public void save(@Nonnull List<Illustration> records, @Nonnull Path file) throws IOException {
		Objects.requireNonNull(records, "records must not be null");
		Objects.requireNonNull(file, "file must not be null");

		AtomicFiles.write(file, TEMP_SUFFIX, out -> {
			this.writer.writeValue(out, records);
			out.write('\n');
		});
	}
}
