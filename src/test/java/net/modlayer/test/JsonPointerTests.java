/*
 * Copyright 2016 FabricMC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.modlayer.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.patch.PatchException;
import net.modlayer.loader.impl.document.DocumentParser;
import net.modlayer.loader.impl.patch.JsonPointer;

public class JsonPointerTests {
	private DocumentNode document;

	@BeforeEach
	public void setUp() throws IOException {
		document = DocumentParser.parse("{\"stats\":{\"hp\":10},\"items\":[\"sword\",\"shield\"],\"a/b\":1,\"m~n\":2,\"~1\":3,\"\":4}");
	}

	@Test
	@DisplayName("The empty pointer addresses the whole document")
	public void root() throws PatchException {
		JsonPointer pointer = JsonPointer.parse("");

		assertTrue(pointer.isRoot());
		assertSame(document, pointer.resolve(document));
	}

	@Test
	public void segments() throws PatchException {
		assertEquals(Arrays.asList("stats", "hp"), JsonPointer.parse("/stats/hp").getSegments());
		assertEquals("10", JsonPointer.parse("/stats/hp").resolve(document).toString());
		assertEquals("\"shield\"", JsonPointer.parse("/items/1").resolve(document).toString());
	}

	@Test
	@DisplayName("Escapes decode ~1 before ~0")
	public void escapes() throws PatchException {
		assertEquals(Collections.singletonList("a/b"), JsonPointer.parse("/a~1b").getSegments());
		assertEquals(Collections.singletonList("m~n"), JsonPointer.parse("/m~0n").getSegments());
		assertEquals(Collections.singletonList("~1"), JsonPointer.parse("/~01").getSegments(), "~01 must decode to ~1, not /");

		assertEquals("1", JsonPointer.parse("/a~1b").resolve(document).toString());
		assertEquals("2", JsonPointer.parse("/m~0n").resolve(document).toString());
		assertEquals("3", JsonPointer.parse("/~01").resolve(document).toString());

		assertEquals("a~1b~0c", JsonPointer.escape("a/b~c"));
		assertEquals("a/b~c", JsonPointer.unescape(JsonPointer.escape("a/b~c")));
	}

	@Test
	@DisplayName("A lone slash addresses the empty key")
	public void emptyKey() throws PatchException {
		JsonPointer pointer = JsonPointer.parse("/");

		assertEquals(Collections.singletonList(""), pointer.getSegments());
		assertEquals("4", pointer.resolve(document).toString());
	}

	@Test
	public void invalidSyntax() {
		PatchException e = assertThrows(PatchException.class, () -> JsonPointer.parse("stats/hp"));
		assertEquals(PatchException.Kind.INVALID_OPERATION, e.getKind());

		e = assertThrows(PatchException.class, () -> JsonPointer.parse(null));
		assertEquals(PatchException.Kind.INVALID_OPERATION, e.getKind());
	}

	@Test
	@DisplayName("Unresolvable paths")
	public void notFound() {
		for (String path : new String[] { "/missing", "/stats/mp", "/items/2", "/items/-", "/items/first", "/items/-1", "/stats/hp/deeper", "/items/" }) {
			PatchException e = assertThrows(PatchException.class, () -> JsonPointer.parse(path).resolve(document), () -> path + " should not resolve");
			assertEquals(PatchException.Kind.PATH_NOT_FOUND, e.getKind(), path);
		}
	}

	@Test
	public void parent() throws PatchException {
		JsonPointer pointer = JsonPointer.parse("/stats/mp");

		assertSame(document.getAsObject().get("stats"), pointer.resolveParent(document), "The parent of a missing key must still resolve");
		assertEquals("mp", pointer.getLastSegment());

		PatchException e = assertThrows(PatchException.class, () -> JsonPointer.parse("").resolveParent(document));
		assertEquals(PatchException.Kind.PATH_NOT_FOUND, e.getKind());
	}

	@Test
	public void equality() throws PatchException {
		assertEquals(JsonPointer.parse("/a~1b"), JsonPointer.parse("/a~1b"));
		assertEquals("/a~1b", JsonPointer.parse("/a~1b").toString());
	}
}
