package com.tarterware.cvi.utilities;

public class StringUtilities {
	/**
	 * Test if string is null, empty, or blank.
	 * @param str String to be evaluated
	 * @return true if the string is null, empty, or blank.
	 */
	public static boolean isNullEmptyOrBlank(String str) {
		if(str == null) {
			return true;
		}
		if(str.trim().isEmpty()) {
			return true;
		}
		
		return false;
	}

	/**
	 * Parse an integer key, such as a rank or palette reference, tolerating
	 * surrounding whitespace.
	 * @param str String to be parsed
	 * @return the parsed value, or null if the string is not an integer.
	 */
	public static Integer parseIntegerOrNull(String str) {
		if(isNullEmptyOrBlank(str)) {
			return null;
		}
		try {
			return Integer.valueOf(str.trim());
		}
		catch(NumberFormatException e) {
			return null;
		}
	}
}
