package org.quarkup;

/** An item that has a name */
public interface Named {
	/** @return The name of the item */
	public String getName();
}
