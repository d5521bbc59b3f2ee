package io.vena.chronicle.state;

import io.vena.chronicle.Identifier;
import io.vena.chronicle.Observable;
import io.vena.chronicle.ObservableProperty;
import io.vena.chronicle.ObservableSchema;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class TestDocument extends Observable {
	public static final ObservableProperty<String> TITLE = ObservableProperty.of("title", String.class, "");
	public static final ObservableProperty<Integer> PAGES = ObservableProperty.of("pages", Integer.class, 0);
	public static final ObservableProperty<Status> STATUS = ObservableProperty.of("status", Status.class, Status.DRAFT);
	public static final ObservableProperty<LocalDate> CREATED = ObservableProperty.of("created", LocalDate.class);
	public static final ObservableProperty<TestNode> ROOT_NODE = ObservableProperty.of("rootNode", TestNode.class);
	@SuppressWarnings({"unchecked", "rawtypes"})
	public static final ObservableProperty<List<Object>> TAGS = ObservableProperty.of("tags", (Class) List.class);
	@SuppressWarnings({"unchecked", "rawtypes"})
	public static final ObservableProperty<Map<String, Object>> METADATA = ObservableProperty.of("metadata", (Class) Map.class);

	public static final ObservableSchema SCHEMA = ObservableSchema.of(TestDocument.class,
		TITLE, PAGES, STATUS, CREATED, ROOT_NODE, TAGS, METADATA);

	public enum Status { DRAFT, PUBLISHED, ARCHIVED }

	public TestDocument() {
		super(SCHEMA);
	}

	public TestDocument(Identifier id) {
		super(SCHEMA, id);
	}

	public String title() { return get(TITLE); }
	public void title(String value) { set(TITLE, value); }
	public Integer pages() { return get(PAGES); }
	public TestNode rootNode() { return get(ROOT_NODE); }
	public void rootNode(TestNode value) { set(ROOT_NODE, value); }
}
