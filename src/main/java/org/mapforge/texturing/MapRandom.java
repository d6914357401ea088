package org.mapforge.texturing;

import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.math.Vec;
import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

/**
 * Deterministic random sources. Each source is a {@link Well19937c} generator seeded from a SHA-256
 * digest of the map hash, a purpose name and any number of values, so the same map and inputs always
 * yield the same choices while unrelated purposes stay independent.
 */
public final class MapRandom {

    private final byte[] mapHash;

    public MapRandom(byte[] mapHash) {
        this.mapHash = mapHash.clone();
    }

    /**
     * Hashes the instance layout of a document: every instance file, name and placement, in order,
     * plus the number of world brushes.
     *
     * @param doc the document.
     * @return the random factory for this map.
     */
    public static MapRandom fromDocument(MapDocument doc) {
        MessageDigest digest = sha256();
        for (Entity inst : doc.instances()) {
            update(digest, inst.file());
            update(digest, inst.targetname());
            update(digest, inst.origin().toString());
            update(digest, inst.get("angles", "0 0 0"));
        }
        update(digest, Integer.toString(doc.brushes().size()));
        return new MapRandom(digest.digest());
    }

    /**
     * @param name the purpose of the source.
     * @param values further inputs; vectors and other objects contribute their string form.
     * @return a fresh random source, adapted to {@link Random}.
     */
    public Random seed(String name, Object... values) {
        MessageDigest digest = sha256();
        digest.update(mapHash);
        update(digest, name);
        for (Object value : values) {
            if (value instanceof Vec v) {
                update(digest, v.snapped().toString());
            } else {
                update(digest, String.valueOf(value));
            }
        }
        return new RandomAdaptor(new Well19937c(ByteBuffer.wrap(digest.digest()).getLong()));
    }

    private static void update(MessageDigest digest, String text) {
        digest.update(text.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
