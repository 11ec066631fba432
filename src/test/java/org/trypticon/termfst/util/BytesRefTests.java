package org.trypticon.termfst.util;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;

/**
 * Tests for {@link BytesRef}, {@link BytesRefBuilder} and {@link StringHelper}.
 */
public class BytesRefTests {

    @Test
    public void testUnsignedOrder() {
        BytesRef low = new BytesRef(new byte[] { 0x7f });
        BytesRef high = new BytesRef(new byte[] { (byte) 0x80 });
        assertThat(low.compareTo(high), lessThan(0));
        assertThat(new BytesRef("ab").compareTo(new BytesRef("a")), greaterThan(0));
        assertThat(new BytesRef("a").compareTo(new BytesRef("a")), is(0));
    }

    @Test
    public void testSliceEquality() {
        byte[] bytes = "xxabyy".getBytes(StandardCharsets.UTF_8);
        BytesRef slice = new BytesRef(bytes, 2, 2);
        assertThat(slice.equals(new BytesRef("ab")), is(true));
        assertThat(slice.hashCode(), is(new BytesRef("ab").hashCode()));
        assertThat(BytesRef.deepCopyOf(slice).offset, is(0));
        assertThat(slice.utf8ToString(), is("ab"));
    }

    @Test
    public void testUtf8() {
        BytesRef ref = new BytesRef("café");
        assertThat(ref.length, is(5));
        assertThat(ref.utf8ToString(), is("café"));
    }

    @Test
    public void testBuilder() {
        BytesRefBuilder builder = new BytesRefBuilder();
        builder.append(new BytesRef("ab"));
        builder.append((byte) 'c');
        assertThat(builder.get().utf8ToString(), is("abc"));
        builder.setLength(1);
        assertThat(builder.toBytesRef().utf8ToString(), is("a"));
        builder.copyBytes(new BytesRef("xyz"));
        assertThat(builder.length(), is(3));
        builder.clear();
        assertThat(builder.length(), is(0));
    }

    @Test
    public void testBytesDifference() {
        assertThat(StringHelper.bytesDifference(new BytesRef("apple"), new BytesRef("apply")), is(4));
        assertThat(StringHelper.bytesDifference(new BytesRef("app"), new BytesRef("apple")), is(3));
        assertThat(StringHelper.bytesDifference(new BytesRef(""), new BytesRef("a")), is(0));
    }

    @Test
    public void testPrefixSuccessor() {
        assertThat(StringHelper.prefixSuccessor(new BytesRef("ab")).utf8ToString(), is("ac"));
        BytesRef withMax = new BytesRef(new byte[] { 'a', (byte) 0xff, (byte) 0xff });
        assertThat(StringHelper.prefixSuccessor(withMax).utf8ToString(), is("b"));
        assertThat(StringHelper.prefixSuccessor(new BytesRef(new byte[] { (byte) 0xff })), is(nullValue()));
        assertThat(StringHelper.prefixSuccessor(new BytesRef("")), is(nullValue()));
    }
}
