package works.delta.tree;

public enum NodeKind {
	OBJECT,
	ARRAY,
	NUMBER,
	STRING,
	BOOLEAN,
	NULL,
}
