package org.javai.text2sql.linking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.javai.text2sql.schema.ForeignKeyInfo;
import org.javai.text2sql.schema.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a set of matched tables along foreign keys.
 *
 * <p>Three passes run in a fixed order and share one cap on the number of added tables:</p>
 * <ol>
 *   <li>outbound: tables referenced by a foreign key of a matched table</li>
 *   <li>inbound: tables whose foreign keys reference a matched table</li>
 *   <li>junction: tables whose foreign keys reference at least two distinct tables already in the
 *       expanded set</li>
 * </ol>
 * <p>Within a pass, candidates are visited in schema order. Table names compare case-insensitively.</p>
 */
public class RelatedTableInferrer {

	private static final Logger logger = LoggerFactory.getLogger(RelatedTableInferrer.class);

	private final int maxRelatedTables;

	public RelatedTableInferrer(int maxRelatedTables) {
		if (maxRelatedTables < 0) {
			throw new IllegalArgumentException("maxRelatedTables must be non-negative");
		}
		this.maxRelatedTables = maxRelatedTables;
	}

	public List<TableInfo> infer(List<TableInfo> sourceTables, List<TableInfo> allTables) {
		return expand(sourceTables, allTables).tables();
	}

	public Expansion expand(List<TableInfo> sourceTables, List<TableInfo> allTables) {
		Expansion expansion = new Expansion(sourceTables);
		logger.debug("Inferring related tables for {} source tables", sourceTables.size());

		// Pass 1: outbound
		outbound:
		for (TableInfo source : sourceTables) {
			for (ForeignKeyInfo fk : source.foreignKeys()) {
				if (expansion.isFull()) {
					break outbound;
				}
				if (expansion.contains(fk.referencedTableName())) {
					continue;
				}
				TableInfo.find(allTables, fk.referencedTableName()).ifPresent(referenced ->
						expansion.add(referenced, MatchType.REFERENCED_TABLE, List.of(source.tableName())));
			}
		}

		// Pass 2: inbound
		inbound:
		for (TableInfo source : sourceTables) {
			for (TableInfo candidate : allTables) {
				if (expansion.isFull()) {
					break inbound;
				}
				if (!expansion.contains(candidate.tableName()) && candidate.references(source.tableName())) {
					expansion.add(candidate, MatchType.REFERENCING_TABLE, List.of(source.tableName()));
				}
			}
		}

		// Pass 3: junction tables, measured against the set as it stood after pass 2
		Set<String> expanded = Set.copyOf(expansion.names);
		for (TableInfo candidate : allTables) {
			if (expansion.isFull()) {
				break;
			}
			if (expansion.contains(candidate.tableName())) {
				continue;
			}
			Map<String, String> bridged = new LinkedHashMap<>();
			for (ForeignKeyInfo fk : candidate.foreignKeys()) {
				if (expanded.contains(key(fk.referencedTableName()))) {
					bridged.putIfAbsent(key(fk.referencedTableName()), fk.referencedTableName());
				}
			}
			if (bridged.size() >= 2) {
				expansion.add(candidate, MatchType.JUNCTION_TABLE, List.copyOf(bridged.values()));
			}
		}

		logger.info("Related table inference finished: {} source tables expanded to {}",
				sourceTables.size(), expansion.tables.size());
		return expansion;
	}

	private static String key(String tableName) {
		return tableName.toLowerCase(Locale.ROOT);
	}

	/**
	 * Source tables followed by the tables added to them, with one detail per addition.
	 */
	public final class Expansion {

		private final List<TableInfo> tables;
		private final List<SchemaMatchDetail> additions = new ArrayList<>();
		private final Set<String> names = new LinkedHashSet<>();
		private final int limit;

		private Expansion(List<TableInfo> sourceTables) {
			this.tables = new ArrayList<>(sourceTables);
			sourceTables.forEach(t -> names.add(key(t.tableName())));
			this.limit = sourceTables.size() + maxRelatedTables;
		}

		public List<TableInfo> tables() {
			return List.copyOf(tables);
		}

		public List<SchemaMatchDetail> additions() {
			return List.copyOf(additions);
		}

		private boolean contains(String tableName) {
			return names.contains(key(tableName));
		}

		private boolean isFull() {
			return tables.size() >= limit;
		}

		private void add(TableInfo table, MatchType matchType, List<String> because) {
			tables.add(table);
			names.add(key(table.tableName()));
			additions.add(SchemaMatchDetail.related(table.tableName(), matchType, because));
			logger.debug("Added {} table {}", matchType, table.tableName());
		}
	}
}
