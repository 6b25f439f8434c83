/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [http://neo4j.com]
 *
 * This file is part of Neo4j Spatial.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package org.neo4j.spatial.filter.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBWriter;

/**
 * A 16 byte MD5 digest identifying a source geometry, or any other text that determines a built expression.
 */
public final class GeometryFingerprint {

	public static final GeometryFingerprint NONE = new GeometryFingerprint(new byte[16]);

	private final byte[] digest;

	private GeometryFingerprint(byte[] digest) {
		this.digest = digest;
	}

	public static GeometryFingerprint of(Geometry geometry) {
		if (geometry == null) {
			return NONE;
		}
		return new GeometryFingerprint(md5(new WKBWriter(2, true).write(geometry)));
	}

	public static GeometryFingerprint of(String text) {
		if (text == null) {
			return NONE;
		}
		return new GeometryFingerprint(md5(text.getBytes(StandardCharsets.UTF_8)));
	}

	public byte[] toBytes() {
		return digest.clone();
	}

	public String toHex() {
		StringBuilder sb = new StringBuilder(32);
		for (byte b : digest) {
			sb.append(String.format("%02x", b & 0xff));
		}
		return sb.toString();
	}

	private static byte[] md5(byte[] data) {
		try {
			return MessageDigest.getInstance("MD5").digest(data);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 digest not available", e);
		}
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof GeometryFingerprint that && Arrays.equals(digest, that.digest);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(digest);
	}

	@Override
	public String toString() {
		return toHex().substring(0, 8);
	}
}
