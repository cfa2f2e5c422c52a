/*
 * RingDeque.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of chryssie, an incremental template parser.
 *
 * chryssie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * chryssie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with chryssie.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.util;

import java.util.AbstractCollection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A growable circular buffer supporting constant time insertion and
 * removal at both ends.
 *
 * <p>Unlike {@link java.util.ArrayDeque}, the capacity of the backing array
 * is observable and may be set explicitly. This is what allows pools to
 * refuse to retain deques that have grown too large (see
 * {@link RingDequePool}).
 *
 * <p>When used as a stack, {@link #push} and {@link #pop} operate on the
 * last element. When used as a queue, {@link #addLast} and
 * {@link #removeFirst} are used.
 *
 * <p>This class is not thread-safe.
 *
 * @param <E> the element type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RingDeque<E> extends AbstractCollection<E> {

    private static final int DEFAULT_CAPACITY = 4;

    /**
     * Largest array size the VM will reliably allocate.
     */
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private static final Object[] EMPTY = new Object[0];

    private Object[] elements;
    private int head;
    private int count;

    /**
     * Modification counter used to make iterators fail fast.
     */
    private int modCount;

    /**
     * Creates an empty deque. No array is allocated until the first
     * element is added.
     */
    public RingDeque() {
        elements = EMPTY;
    }

    /**
     * Creates an empty deque with the given initial capacity.
     *
     * @param capacity the initial capacity
     * @throws IllegalArgumentException if capacity is negative
     */
    public RingDeque(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        elements = (capacity == 0) ? EMPTY : new Object[capacity];
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Returns the length of the backing array.
     *
     * @return the current capacity
     */
    public int capacity() {
        return elements.length;
    }

    /**
     * Reallocates the backing array to exactly the given capacity,
     * preserving the logical order of the elements.
     *
     * @param capacity the new capacity
     * @throws IllegalArgumentException if capacity is smaller than the
     *         number of elements currently held
     */
    public void setCapacity(int capacity) {
        if (capacity < count) {
            throw new IllegalArgumentException("Capacity " + capacity
                    + " cannot be smaller than count " + count);
        }
        if (capacity != elements.length) {
            reallocate(capacity);
        }
    }

    @Override
    public boolean add(E element) {
        addLast(element);
        return true;
    }

    /**
     * Inserts an element at the front of this deque.
     *
     * @param element the element to add
     */
    public void addFirst(E element) {
        if (count == elements.length) {
            grow(count + 1);
        }
        head = dec(head);
        elements[head] = element;
        count++;
        modCount++;
    }

    /**
     * Inserts an element at the end of this deque.
     *
     * @param element the element to add
     */
    public void addLast(E element) {
        if (count == elements.length) {
            grow(count + 1);
        }
        elements[index(count)] = element;
        count++;
        modCount++;
    }

    /**
     * Pushes an element onto the stack represented by this deque.
     * Equivalent to {@link #addLast}.
     *
     * @param element the element to push
     */
    public void push(E element) {
        addLast(element);
    }

    /**
     * Pops the element on top of the stack represented by this deque.
     * Equivalent to {@link #removeLast}.
     *
     * @return the element removed
     * @throws NoSuchElementException if this deque is empty
     */
    public E pop() {
        return removeLast();
    }

    /**
     * Removes and returns the first element.
     *
     * @return the first element
     * @throws NoSuchElementException if this deque is empty
     */
    @SuppressWarnings("unchecked")
    public E removeFirst() {
        if (count == 0) {
            throw new NoSuchElementException();
        }
        E element = (E) elements[head];
        elements[head] = null;
        head = inc(head);
        count--;
        modCount++;
        return element;
    }

    /**
     * Removes and returns the last element.
     *
     * @return the last element
     * @throws NoSuchElementException if this deque is empty
     */
    @SuppressWarnings("unchecked")
    public E removeLast() {
        if (count == 0) {
            throw new NoSuchElementException();
        }
        int i = index(count - 1);
        E element = (E) elements[i];
        elements[i] = null;
        count--;
        modCount++;
        return element;
    }

    /**
     * Returns the first element without removing it.
     *
     * @return the first element, or null if this deque is empty
     */
    @SuppressWarnings("unchecked")
    public E peekFirst() {
        return (count == 0) ? null : (E) elements[head];
    }

    /**
     * Returns the last element without removing it.
     *
     * @return the last element, or null if this deque is empty
     */
    @SuppressWarnings("unchecked")
    public E peekLast() {
        return (count == 0) ? null : (E) elements[index(count - 1)];
    }

    /**
     * Returns the element at the given logical index, 0 being the first.
     *
     * @param i the logical index
     * @return the element
     * @throws IndexOutOfBoundsException if i is out of range
     */
    @SuppressWarnings("unchecked")
    public E get(int i) {
        if (i < 0 || i >= count) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for length " + count);
        }
        return (E) elements[index(i)];
    }

    @Override
    public void clear() {
        if (count > 0) {
            int tail = head + count;
            if (tail <= elements.length) {
                java.util.Arrays.fill(elements, head, tail, null);
            } else {
                // Wrapped: clear to the end of the array, then the remainder
                java.util.Arrays.fill(elements, head, elements.length, null);
                java.util.Arrays.fill(elements, 0, tail - elements.length, null);
            }
        }
        head = 0;
        count = 0;
        modCount++;
    }

    @Override
    public Iterator<E> iterator() {
        return new RingIterator();
    }

    private int index(int logical) {
        int i = head + logical;
        return (i >= elements.length) ? i - elements.length : i;
    }

    private int inc(int i) {
        return (++i == elements.length) ? 0 : i;
    }

    private int dec(int i) {
        return (--i < 0) ? elements.length - 1 : i;
    }

    private void grow(int minCapacity) {
        long doubled = (elements.length == 0) ? DEFAULT_CAPACITY : 2L * elements.length;
        int newCapacity = (int) Math.min(doubled, MAX_ARRAY_LENGTH);
        if (newCapacity < minCapacity) {
            newCapacity = minCapacity;
        }
        reallocate(newCapacity);
    }

    /**
     * Copies the elements into a new array of the given length, unwrapping
     * them so that the first element is at index 0.
     */
    private void reallocate(int capacity) {
        Object[] newElements = (capacity == 0) ? EMPTY : new Object[capacity];
        if (count > 0) {
            int firstPart = Math.min(count, elements.length - head);
            System.arraycopy(elements, head, newElements, 0, firstPart);
            if (firstPart < count) {
                System.arraycopy(elements, 0, newElements, firstPart, count - firstPart);
            }
        }
        elements = newElements;
        head = 0;
        modCount++;
    }

    private class RingIterator implements Iterator<E> {

        private final int expectedModCount = modCount;
        private int next;

        @Override
        public boolean hasNext() {
            return next < count;
        }

        @Override
        @SuppressWarnings("unchecked")
        public E next() {
            if (expectedModCount != modCount) {
                throw new ConcurrentModificationException();
            }
            if (next >= count) {
                throw new NoSuchElementException();
            }
            return (E) elements[index(next++)];
        }
    }

}
