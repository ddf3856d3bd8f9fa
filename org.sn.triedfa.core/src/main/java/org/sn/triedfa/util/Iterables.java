package org.sn.triedfa.util;

import java.util.Iterator;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;


public class Iterables {
    private Iterables() {
    }

    /**
     * An interface indicating that an iterable has a size function.
     */
    public interface Sized {
        int size();
    }

    /**
     * Return a CharSequence as an iterable of chars, where each char is a Character (not char).
     * The iterable is a view: it reads the CharSequence each time iterator() is called.
     */
    public static Iterable<Character> charsIteratorAsChar(@Nonnull CharSequence str) {
        return new SizedCharacterStreamIterable(str::chars, str.length());
    }


    private record SizedCharacterStreamIterable(Supplier<IntStream> streamSupplier,
                                                int size) implements Iterable<Character>, Sized {

        @Override
        public @Nonnull Iterator<Character> iterator() {
            return streamSupplier.get().mapToObj(intValue -> (char) intValue).iterator();
        }
    }
}
