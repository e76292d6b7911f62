package com.crdtypes.generator.codegen;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.crdtypes.generator.codegen.model.CompositeField;
import com.crdtypes.generator.codegen.model.CompositeType;
import com.crdtypes.generator.codegen.model.EnumVariant;
import com.crdtypes.generator.codegen.model.EnumeratedType;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.TypeKind;
import com.crdtypes.generator.codegen.model.TypeRef;

/**
 * Calculates a structural signature (hash) for a generated type. Two types with
 * identical structure have the same signature, whatever they are called.
 *
 * Composite signatures cover the order-insensitive set of (field name, field
 * type, optionality) triples. Unit enums are keyed by their ordered literals,
 * tagged enums by their set of (variant name, payload) pairs.
 *
 * Signatures are computed for all registered types at once by partition
 * refinement: every round re-hashes each type with the previous round's
 * signatures of the types it names, until the number of distinct signatures
 * stops growing. Recursive types of the same shape therefore agree, and a
 * round costs time linear in the size of the types, with at most one round per
 * type.
 */
public class StructuralSignatureCalculator {

	private final Map<String, GeneratedType> types;

	private Map<String, String> signatures;

	public StructuralSignatureCalculator(Map<String, GeneratedType> types) {
		this.types = types;
	}

	public String calculateSignature(String typeName) {
		if (signatures == null) {
			signatures = refine();
		}
		String signature = signatures.get(typeName);
		if (signature == null) {
			throw new IllegalStateException("No type registered under " + typeName);
		}
		return signature;
	}

	private Map<String, String> refine() {
		Map<String, String> current = new HashMap<>();
		for (GeneratedType type : types.values()) {
			current.put(type.getName(), hashString(canonicalForm(type, null)));
		}
		int classes = distinct(current);
		while (true) {
			Map<String, String> next = new HashMap<>();
			for (GeneratedType type : types.values()) {
				next.put(type.getName(), hashString(current.get(type.getName()) + canonicalForm(type, current)));
			}
			int refined = distinct(next);
			current = next;
			if (refined == classes) {
				return current;
			}
			classes = refined;
		}
	}

	private static int distinct(Map<String, String> signatures) {
		return new HashSet<>(signatures.values()).size();
	}

	/**
	 * Canonical text of one type. Named references are replaced by the given
	 * signatures, or by a plain marker when there are none yet.
	 */
	private String canonicalForm(GeneratedType type, Map<String, String> previous) {
		StringBuilder sb = new StringBuilder();
		if (type instanceof CompositeType composite) {
			sb.append("COMPOSITE{");
			List<String> entries = new ArrayList<>();
			for (CompositeField field : composite.getFields()) {
				entries.add(field.getName() + ":" + refSignature(field.getType(), previous) + ":"
						+ (field.isOptional() ? "OPT" : "REQ"));
			}
			sb.append(entries.stream().sorted().collect(Collectors.joining(",")));
			sb.append("}");
		} else if (type instanceof EnumeratedType enumerated && type.getKind() == TypeKind.UNIT_ENUM) {
			sb.append("UNIT[");
			sb.append(enumerated.getVariants().stream()
					.map(EnumVariant::getLiteral)
					.map(literal -> (literal instanceof String ? "s:" : "i:") + literal)
					.collect(Collectors.joining(",")));
			sb.append("]");
		} else if (type instanceof EnumeratedType enumerated) {
			sb.append("TAGGED{");
			List<String> entries = new ArrayList<>();
			for (EnumVariant variant : enumerated.getVariants()) {
				entries.add(variant.getName() + "=" + refSignature(variant.getPayload(), previous));
			}
			sb.append(entries.stream().sorted().collect(Collectors.joining(",")));
			sb.append("}");
		}
		return sb.toString();
	}

	private String refSignature(TypeRef ref, Map<String, String> previous) {
		if (ref instanceof TypeRef.PrimitiveRef primitive) {
			return "p:" + primitive.getType();
		} else if (ref instanceof TypeRef.ExternalRef external) {
			return "x:" + external.getShape();
		} else if (ref instanceof TypeRef.SequenceRef sequence) {
			return "[" + refSignature(sequence.getElement(), previous) + "]";
		} else if (ref instanceof TypeRef.MapRef map) {
			return "{" + refSignature(map.getValue(), previous) + "}";
		} else if (ref instanceof TypeRef.OptionalRef optional) {
			return "o(" + refSignature(optional.getInner(), previous) + ")";
		} else if (ref instanceof TypeRef.NamedRef named) {
			if (!types.containsKey(named.getTypeName())) {
				throw new IllegalStateException("No type registered under " + named.getTypeName());
			}
			return previous == null ? "n" : "n(" + previous.get(named.getTypeName()) + ")";
		}
		return "?";
	}

	/**
	 * Hash a string to produce a compact signature.
	 */
	private static String hashString(String input) {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
			// Return first 16 characters of hex hash for compact representation
			return HexFormat.of().formatHex(hash).substring(0, 16);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}
